/**
 * Configuration for the Commcell client.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.commcellsdk.config.CommcellConfig} – connection settings bound from {@code commcell.*} properties.</li>
 *   <li>{@link org.tanzu.commcellsdk.config.CommcellConfigProcessor} – fills missing settings from Cloud Foundry {@code VCAP_SERVICES}.</li>
 *   <li>{@link org.tanzu.commcellsdk.config.WebClientConfig} – WebClient builder with SSL and timeout settings.</li>
 *   <li>{@link org.tanzu.commcellsdk.config.TaskExecutionConfig} – executor for parallel feature initialization.</li>
 * </ul>
 */
package org.tanzu.commcellsdk.config;
