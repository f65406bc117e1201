/**
 * Shared contracts of the feature clients.
 */
package org.tanzu.commcellsdk.entity;
