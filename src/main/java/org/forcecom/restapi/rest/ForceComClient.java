package org.forcecom.restapi.rest;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.forcecom.restapi.model.ClientSettings;
import org.forcecom.restapi.model.OAuthCredentials;
import org.forcecom.restapi.model.SessionContext;
import org.forcecom.restapi.rest.parser.XmlQueryPageParser;
import org.forcecom.restapi.rest.service.HttpRequestBuilder;
import org.forcecom.restapi.rest.service.HttpRequestExecutor;
import org.forcecom.restapi.rest.service.OAuthAuthenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * Entry point of the Force.com REST client.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Signs in with the OAuth username-password flow.</li>
 *   <li>Runs SOQL through the query and queryAll resources.</li>
 *   <li>Resumes a query from a server-issued {@code nextRecordsUrl}.</li>
 * </ul>
 * Every query call follows continuations to the last page and returns one materialized
 * {@link QueryResult}.
 * </p>
 *
 * <pre>{@code
 * try (ForceComClient client = new ForceComClient(ClientSettings.from(new SystemPropertyConfiguration()))) {
 *     SessionContext session = client.login(credentials);
 *     QueryResult accounts = client.query(session, "SELECT Id, Name FROM Account");
 * }
 * }</pre>
 */
public class ForceComClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ForceComClient.class);

    private final ClientSettings settings;
    private final HttpRequestExecutor httpRequestExecutor;
    private final OAuthAuthenticator authenticator;
    private final PaginatedQueryEngine queryEngine;

    public ForceComClient(ClientSettings settings) {
        this.settings = settings;
        HttpRequestBuilder httpRequestBuilder = new HttpRequestBuilder(settings);
        this.httpRequestExecutor = new HttpRequestExecutor(settings);
        this.authenticator = new OAuthAuthenticator(settings, httpRequestBuilder, httpRequestExecutor);
        this.queryEngine = new PaginatedQueryEngine(httpRequestBuilder, httpRequestExecutor,
                new XmlQueryPageParser(new FieldTextNormalizer(settings.getTargetEncoding())));
    }

    public ClientSettings getSettings() {
        return settings;
    }

    /**
     * Signs in and returns the session for subsequent calls.
     *
     * @param credentials User and connected app credentials
     * @return New session
     */
    public SessionContext login(OAuthCredentials credentials) {
        return authenticator.login(credentials);
    }

    /**
     * Executes a SOQL query and returns all matching records.
     *
     * @param session Authorized session
     * @param soql    SOQL statement
     * @return Records of every page
     */
    public QueryResult query(SessionContext session, String soql) {
        return run(SoqlEndpoint.QUERY, session, soql);
    }

    /**
     * Like {@link #query}, but includes deleted and archived records.
     *
     * @param session Authorized session
     * @param soql    SOQL statement
     * @return Records of every page
     */
    public QueryResult queryAll(SessionContext session, String soql) {
        return run(SoqlEndpoint.QUERY_ALL, session, soql);
    }

    /**
     * Continues a query from a {@code nextRecordsUrl} issued by the service.
     *
     * @param session        Authorized session
     * @param nextRecordsUrl Continuation reference, e.g. {@code /services/data/v35.0/query/01gD0000002HU6KIAW-2000}
     * @return Records of that page and every page after it
     */
    public QueryResult queryMore(SessionContext session, String nextRecordsUrl) {
        return queryEngine.queryMore(session, nextRecordsUrl);
    }

    private QueryResult run(SoqlEndpoint endpoint, SessionContext session, String soql) {
        Preconditions.checkArgument(StringUtils.isNotBlank(soql), "SOQL statement is empty");
        QueryResult result = queryEngine.queryMore(session, endpoint.path(session.getApiVersion(), soql));
        logger.debug("{} returned {} records in {} pages", endpoint, result.size(), result.getPageCount());
        return result;
    }

    @Override
    public void close() throws IOException {
        httpRequestExecutor.close();
    }
}
