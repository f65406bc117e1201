/**
 * Read-only MCP tools for browsing a Commcell.
 */
package org.tanzu.commcellsdk.mcp;
