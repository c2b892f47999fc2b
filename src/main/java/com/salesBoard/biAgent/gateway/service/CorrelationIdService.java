package com.salesBoard.biAgent.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Assigns the correlation ID that ties together the log lines of one question.
 */
@Service
public class CorrelationIdService {

    public static final String HEADER = "X-Correlation-Id";

    static final int MAX_LENGTH = 64;

    private static final Pattern LOG_SAFE = Pattern.compile("[A-Za-z0-9._-]+");

    /**
     * Keeps an ID supplied by the caller when it is short and safe to write into logs;
     * otherwise generates a new one.
     *
     * @param supplied Value of the {@value #HEADER} header, may be null
     * @return Correlation ID for this request
     */
    public String resolve(String supplied) {
        if (supplied != null && supplied.length() <= MAX_LENGTH && LOG_SAFE.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
