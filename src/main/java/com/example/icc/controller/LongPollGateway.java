package com.example.icc.controller;

import com.example.icc.auth.AuthContext;
import com.example.icc.auth.Authenticator;
import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.CancelledException;
import com.example.icc.error.ErrorKind;
import com.example.icc.error.IccException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.async.DeferredResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Turns long-poll HTTP requests into calls on a {@link Receiver} or {@link Sender}.
 *
 * <p>This is the only place that decides what a client gets to see of an error.
 * {@link IccException}s are echoed; everything else is logged and replaced by a fixed
 * message.
 */
@Component
public class LongPollGateway {

    private static final Logger logger = LoggerFactory.getLogger(LongPollGateway.class);

    static final String INTERNAL_TYPE = "internal";
    static final String INTERNAL_MESSAGE = "Ups, something went wrong!";

    private final Executor executor;
    private final ObjectMapper objectMapper;
    private final Duration receiveTimeout;

    public LongPollGateway(@Qualifier("iccExecutor") Executor executor,
                           ObjectMapper objectMapper,
                           @Value("${icc.http.receive-timeout:PT0S}") Duration receiveTimeout) {
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.receiveTimeout = receiveTimeout;
    }

    /**
     * Blocks on {@code receiver} until it has data. Errors are answered with status 200 and
     * an error body, which long-poll clients read instead of retrying at the HTTP level.
     * When the client goes away the receive is cancelled and nothing is written.
     */
    public DeferredResult<ResponseEntity<byte[]>> handleReceive(Receiver receiver,
                                                                Authenticator authenticator,
                                                                HttpServletRequest request) {
        DeferredResult<ResponseEntity<byte[]>> result = new DeferredResult<>(receiveTimeout.toMillis());
        CancelSignal cancel = new CancelSignal();
        result.onTimeout(() -> {
            cancel.cancel();
            result.setResult(ResponseEntity.noContent().build());
        });
        result.onError(error -> cancel.cancel());
        result.onCompletion(cancel::cancel);

        AuthContext context;
        try {
            context = authenticator.authenticate(request);
        } catch (RuntimeException e) {
            result.setResult(receiveError(e));
            return result;
        }

        executor.execute(() -> {
            try {
                byte[] data = receiver.receive(cancel);
                result.setResult(ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(data));
            } catch (CancelledException e) {
                logger.debug("Receive for user {} cancelled", authenticator.userId(context));
            } catch (RuntimeException e) {
                result.setResult(receiveError(e));
            }
        });
        return result;
    }

    /**
     * Hands the request body to {@code sender} on behalf of the authenticated user.
     */
    public ResponseEntity<byte[]> handleSend(Sender sender,
                                             Authenticator authenticator,
                                             HttpServletRequest request,
                                             byte[] body) {
        long userId;
        try {
            userId = authenticator.userId(authenticator.authenticate(request));
        } catch (IccException e) {
            return errorResponse(e.getKind().status(), e.getKind().type(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Authenticating send request failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_TYPE, INTERNAL_MESSAGE);
        }

        if (userId == AuthContext.ANONYMOUS_USER_ID && sender.requiresIdentity()) {
            return errorResponse(ErrorKind.NOT_ALLOWED.status(), ErrorKind.NOT_ALLOWED.type(), "Anonymous user can not send messages");
        }

        try {
            sender.send(userId, body == null ? new byte[0] : body);
        } catch (IccException e) {
            logger.debug("Send from user {} rejected: {}", userId, e.getMessage());
            return errorResponse(e.getKind().status(), e.getKind().type(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Sending for user {} failed", userId, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_TYPE, INTERNAL_MESSAGE);
        }
        return ResponseEntity.ok().build();
    }

    private ResponseEntity<byte[]> receiveError(RuntimeException e) {
        if (e instanceof IccException) {
            IccException iccError = (IccException) e;
            return errorResponse(HttpStatus.OK, iccError.getKind().type(), iccError.getMessage());
        }
        logger.error("Receiving failed", e);
        return errorResponse(HttpStatus.OK, INTERNAL_TYPE, INTERNAL_MESSAGE);
    }

    private ResponseEntity<byte[]> errorResponse(HttpStatus status, String type, String message) {
        Map<String, Object> body = Map.of("error", Map.of("type", type, "msg", message));
        byte[] encoded;
        try {
            encoded = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            encoded = ("{\"error\":{\"type\":\"" + INTERNAL_TYPE + "\"}}").getBytes(StandardCharsets.UTF_8);
        }
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(encoded);
    }
}
