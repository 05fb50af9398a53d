/**
 * This package defines the ports the upload orchestrator drives.
 * In a Ports and Adapters architecture, ports are interfaces that define
 * how the application core interacts with external systems; here, the three
 * server calls of an upload session. {@link com.quickshare.upload.client.http.HttpUploadApi}
 * is the HTTP adapter implementing all of them.
 *
 * <p>
 * Every port method returns a {@link java.util.concurrent.CompletableFuture} and must
 * not block the calling thread. Failures are reported by completing the future
 * exceptionally with an {@link com.quickshare.upload.client.exception.UploadException}.
 */
package com.quickshare.upload.client.port;
