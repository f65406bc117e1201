/**
 * Clients of the Commcell and their lookup by name, host name or id.
 */
package org.tanzu.commcellsdk.clients;
