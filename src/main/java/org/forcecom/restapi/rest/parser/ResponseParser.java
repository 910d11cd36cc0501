package org.forcecom.restapi.rest.parser;

/**
 * Interface for decoding Force.com HTTP response bodies into typed envelopes.
 *
 * <p>Each implementation handles one payload shape:</p>
 * <ul>
 *   <li>{@link XmlQueryPageParser}: query and query-more pages (application/xml)</li>
 *   <li>{@link JsonTokenResponseParser}: OAuth token responses (application/json)</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ResponseParser<QueryPage> parser = new XmlQueryPageParser(normalizer);
 * QueryPage page = parser.parse(httpResponse);
 * }</pre>
 *
 * @param <T> decoded envelope type
 */
public interface ResponseParser<T> {

    /**
     * Parses an HTTP response body.
     *
     * @param httpResponse raw HTTP response body as string
     * @return decoded envelope, never null
     * @throws ParseException if the body is not well-formed
     */
    T parse(String httpResponse) throws ParseException;

    /**
     * Returns a human-readable name for this parser.
     * Used for logging and debugging.
     *
     * @return parser name (e.g., "XmlQueryPageParser")
     */
    String getName();

    /**
     * Exception thrown when response parsing fails.
     */
    class ParseException extends Exception {
        public ParseException(String message) {
            super(message);
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
