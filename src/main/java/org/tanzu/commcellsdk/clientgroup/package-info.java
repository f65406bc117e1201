/**
 * Client groups: listing, creation and deletion.
 */
package org.tanzu.commcellsdk.clientgroup;
