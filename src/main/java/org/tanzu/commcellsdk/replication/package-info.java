/**
 * Disaster recovery replication: live sync VM pairs and block level (BLR) pairs.
 */
package org.tanzu.commcellsdk.replication;
