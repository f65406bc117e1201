/**
 * Storage and schedule policies.
 */
package org.tanzu.commcellsdk.policies;
