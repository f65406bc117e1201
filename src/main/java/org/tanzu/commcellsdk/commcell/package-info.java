/**
 * Commcell session layer.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.commcellsdk.commcell.Commcell} – an authenticated session and the entry point to every feature client.</li>
 *   <li>{@link org.tanzu.commcellsdk.commcell.CommcellTransport} – the request dispatcher that attaches the token and renews it on 401.</li>
 *   <li>{@link org.tanzu.commcellsdk.commcell.ResponseClassifier} – maps raw responses to {@link org.tanzu.commcellsdk.commcell.ResponseOutcome}.</li>
 *   <li>{@link org.tanzu.commcellsdk.commcell.Authentication} – login, renewal, logout and token validation.</li>
 *   <li>{@link org.tanzu.commcellsdk.commcell.SdkException} – the single error type, with texts from {@link org.tanzu.commcellsdk.commcell.ErrorCatalog}.</li>
 * </ul>
 */
package org.tanzu.commcellsdk.commcell;
