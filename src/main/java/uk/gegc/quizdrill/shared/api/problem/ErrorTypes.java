package uk.gegc.quizdrill.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the API.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://quizdrill.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI IMPORT_FORMAT = URI.create(BASE_URL + "/import-format");

    // ==================== State Errors ====================
    public static final URI NO_ACTIVE_SESSION = URI.create(BASE_URL + "/no-active-session");
    public static final URI NO_RESULTS = URI.create(BASE_URL + "/no-results");
    public static final URI EMPTY_QUESTION_POOL = URI.create(BASE_URL + "/empty-question-pool");

    // ==================== Storage Errors ====================
    public static final URI STORAGE_FAILED = URI.create(BASE_URL + "/storage-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
