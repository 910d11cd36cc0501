package org.forcecom.restapi.rest;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.forcecom.restapi.model.QueryPage;
import org.forcecom.restapi.model.QueryRecord;
import org.forcecom.restapi.model.SessionContext;
import org.forcecom.restapi.rest.exception.DecodeException;
import org.forcecom.restapi.rest.exception.ServiceException;
import org.forcecom.restapi.rest.exception.TransportException;
import org.forcecom.restapi.rest.parser.ResponseParser;
import org.forcecom.restapi.rest.service.HttpRequestBuilder;
import org.forcecom.restapi.rest.service.HttpRequestExecutor;
import org.forcecom.restapi.rest.service.HttpStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Follows Force.com query continuations until the service reports the last page.
 * <p>
 * Pages are fetched strictly one after another: the URL of page N+1 is only known once page N
 * is decoded. Records are appended in delivery order. The first failure on any page aborts the
 * whole chain and nothing fetched so far is returned.
 * </p>
 * <p>
 * The engine holds no per-call state, so one instance serves concurrent callers.
 * </p>
 */
public class PaginatedQueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedQueryEngine.class);

    private final HttpRequestBuilder httpRequestBuilder;
    private final HttpRequestExecutor httpRequestExecutor;
    private final ResponseParser<QueryPage> pageParser;

    public PaginatedQueryEngine(HttpRequestBuilder httpRequestBuilder,
                                HttpRequestExecutor httpRequestExecutor,
                                ResponseParser<QueryPage> pageParser) {
        this.httpRequestBuilder = httpRequestBuilder;
        this.httpRequestExecutor = httpRequestExecutor;
        this.pageParser = pageParser;
    }

    /**
     * Fetches the page at {@code continuation} and every page after it.
     *
     * @param session      Authorized session
     * @param continuation Query endpoint path or a server-issued {@code nextRecordsUrl}
     * @return Records of all pages in delivery order
     * @throws ServiceException   If any page carries an error payload
     * @throws DecodeException    If any page is not well-formed
     * @throws TransportException If any request fails
     */
    public QueryResult queryMore(SessionContext session, String continuation) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(continuation), "Continuation reference is empty");

        List<QueryRecord> records = new ArrayList<>();
        Integer totalSize = null;
        int pageCount = 0;
        String next = continuation;

        while (next != null) {
            QueryPage page = fetchPage(session, next);
            if (pageCount == 0) {
                totalSize = page.getTotalSize();
            }
            pageCount++;
            records.addAll(page.getRecords());
            logger.debug("Page {} returned {} records ({} so far)", pageCount, page.getRecords().size(), records.size());
            next = page.hasNextRecords() ? page.getNextRecordsUrl() : null;
        }

        return new QueryResult(records, totalSize, pageCount);
    }

    /**
     * Fetches and decodes a single page without following its continuation.
     *
     * @param session      Authorized session
     * @param continuation Query endpoint path or continuation reference
     * @return Decoded page, never carrying an error
     * @throws ServiceException   If the page carries an error payload
     * @throws DecodeException    If the page is not well-formed
     * @throws TransportException If the request fails
     */
    public QueryPage fetchPage(SessionContext session, String continuation) {
        HttpGet request = httpRequestBuilder.buildQueryRequest(session, continuation);
        String url = HttpRequestExecutor.describeUri(request);

        String body;
        try {
            body = httpRequestExecutor.executeRequest(request);
        } catch (HttpStatusException e) {
            // 400/401 answers usually carry an XML Error payload worth surfacing
            QueryPage errorPage = decodeQuietly(e.getResponseBody());
            if (errorPage != null && errorPage.hasError()) {
                throw new ServiceException(errorPage.getError(), e.getStatusCode());
            }
            throw TransportException.buildTransportException(url, e.getStatusCode(), e);
        } catch (IOException e) {
            throw TransportException.buildTransportException(url, e);
        }

        QueryPage page;
        try {
            page = pageParser.parse(body);
        } catch (ResponseParser.ParseException e) {
            throw new DecodeException("Invalid query response from " + url + ": " + e.getMessage(), e);
        }
        if (page.hasError()) {
            throw new ServiceException(page.getError());
        }
        return page;
    }

    private QueryPage decodeQuietly(String body) {
        if (StringUtils.isBlank(body)) {
            return null;
        }
        try {
            return pageParser.parse(body);
        } catch (ResponseParser.ParseException e) {
            logger.debug("Error response is not XML: {}", e.getMessage());
            return null;
        }
    }
}
