package com.stemtutor.core.collaborators;

import com.stemtutor.core.llm.LlmEmptyResponseException;
import com.stemtutor.core.llm.LlmParseException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Sorts collaborator failures into retryable and non-retryable by exception type.
 */
public final class CollaboratorErrors {

    private CollaboratorErrors() {}

    public static RuntimeException classify(String collaborator, Throwable error) {
        if (error instanceof CollaboratorTransientException t) return t;
        if (error instanceof CollaboratorPermanentException p) return p;

        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        if (isTransient(error)) {
            return new CollaboratorTransientException(collaborator, message, error);
        }
        return new CollaboratorPermanentException(collaborator, message, error);
    }

    static boolean isTransient(Throwable error) {
        if (error instanceof TransientAiException
                || error instanceof HttpClientErrorException.TooManyRequests
                || error instanceof HttpServerErrorException
                || error instanceof ResourceAccessException
                || error instanceof IOException
                || error instanceof UncheckedIOException) {
            return true;
        }
        if (error instanceof NonTransientAiException
                || error instanceof LlmParseException
                || error instanceof LlmEmptyResponseException
                || error instanceof HttpClientErrorException) {
            return false;
        }
        Throwable cause = error.getCause();
        return cause != null && cause != error && isTransient(cause);
    }
}
