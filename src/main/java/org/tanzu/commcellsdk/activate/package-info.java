/**
 * Activate features: Datacube analytics engines and datasources, and eDiscovery crawl jobs.
 *
 * <p>{@link org.tanzu.commcellsdk.activate.Datacube} loads its parts in parallel on the
 * session's init executor. {@link org.tanzu.commcellsdk.activate.EdiscoveryClientOperations}
 * starts crawl jobs and polls them until they finish.</p>
 */
package org.tanzu.commcellsdk.activate;
