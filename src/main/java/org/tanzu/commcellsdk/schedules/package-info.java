/**
 * Schedule patterns: frequency types and the {@code pattern} JSON attached to schedule subtasks.
 */
package org.tanzu.commcellsdk.schedules;
