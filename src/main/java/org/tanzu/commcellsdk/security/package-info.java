/**
 * Users and user groups.
 *
 * <p>Deleting a user always transfers its entities to one new owner, either another
 * user or a user group.
 */
package org.tanzu.commcellsdk.security;
