/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.makeready.exception.InvalidSourceDocumentException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.makeready.exception.PoleProcessingException} → 422 Unprocessable Entity</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidSourceDocumentException",
 *   "message": "Invalid source document",
 *   "details": "survey: missing or not an object",
 *   "timestamp": "2026-10-18T09:12:04.211Z"
 * }
 * </pre>
 */
package com.phillippitts.makeready.presentation.exception;
