package org.forcecom.restapi.rest.parser;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import org.forcecom.restapi.model.OAuthTokenResponse;

/**
 * Parses OAuth token endpoint responses with JsonPath. Absent members read as null.
 */
public class JsonTokenResponseParser implements ResponseParser<OAuthTokenResponse> {

    private static final Configuration LENIENT = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS);

    @Override
    public OAuthTokenResponse parse(String httpResponse) throws ParseException {
        DocumentContext document;
        try {
            document = JsonPath.using(LENIENT).parse(httpResponse);
        } catch (InvalidJsonException | IllegalArgumentException e) {
            throw new ParseException("Failed to parse JSON response: " + e.getMessage(), e);
        }

        return OAuthTokenResponse.builder()
                .accessToken(document.read("$.access_token", String.class))
                .instanceUrl(document.read("$.instance_url", String.class))
                .error(document.read("$.error", String.class))
                .errorDescription(document.read("$.error_description", String.class))
                .build();
    }

    @Override
    public String getName() {
        return "JsonTokenResponseParser";
    }
}
