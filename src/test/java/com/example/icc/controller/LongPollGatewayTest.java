package com.example.icc.controller;

import com.example.icc.auth.AuthContext;
import com.example.icc.auth.Authenticator;
import com.example.icc.concurrent.CancelSignal;
import com.example.icc.error.CancelledException;
import com.example.icc.error.ErrorKind;
import com.example.icc.error.IccException;
import com.example.icc.error.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.async.DeferredResult;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LongPollGatewayTest {

    private final LongPollGateway gateway = new LongPollGateway(Runnable::run, new ObjectMapper(), Duration.ZERO);

    @Test
    void testHandleReceive_ReceiverIsCalled() {
        ReceiverStub receiver = new ReceiverStub("my answer", null);

        ResponseEntity<byte[]> response = receive(receiver, new AutherStub(0));

        assertEquals(200, response.getStatusCode().value());
        assertTrue(receiver.called);
        assertEquals("my answer", body(response));
    }

    @Test
    void testHandleReceive_InternalErrorIsHidden() {
        RuntimeException myError = new StoreException("Test error", new IllegalStateException("redis down"));

        ResponseEntity<byte[]> response = receive(new ReceiverStub(null, myError), new AutherStub(0));

        assertEquals(200, response.getStatusCode().value());
        assertFalse(body(response).contains("Test error"));
        assertFalse(body(response).contains("redis down"));
        assertTrue(body(response).contains(LongPollGateway.INTERNAL_TYPE));
    }

    @Test
    void testHandleReceive_ClientErrorIsShown() {
        IccException myError = IccException.invalid("Test error for the client");

        ResponseEntity<byte[]> response = receive(new ReceiverStub(null, myError), new AutherStub(0));

        assertEquals(200, response.getStatusCode().value());
        assertTrue(body(response).contains("Test error for the client"));
        assertTrue(body(response).contains(ErrorKind.INVALID.type()));
    }

    @Test
    void testHandleReceive_CancelledWritesNothing() {
        DeferredResult<ResponseEntity<byte[]>> result = gateway.handleReceive(
                new ReceiverStub(null, new CancelledException()), new AutherStub(0), new MockHttpServletRequest());

        assertFalse(result.hasResult());
    }

    @Test
    void testHandleSend_Anonymous() {
        SenderStub sender = new SenderStub(null);

        ResponseEntity<byte[]> response = gateway.handleSend(sender, new AutherStub(0), post(), new byte[0]);

        assertEquals(401, response.getStatusCode().value());
        assertTrue(body(response).contains(ErrorKind.NOT_ALLOWED.type()));
        assertFalse(sender.called);
    }

    @Test
    void testHandleSend_User() {
        SenderStub sender = new SenderStub(null);

        ResponseEntity<byte[]> response = gateway.handleSend(sender, new AutherStub(1), post(), "{}".getBytes(StandardCharsets.UTF_8));

        assertEquals(200, response.getStatusCode().value());
        assertTrue(sender.called);
        assertEquals(1, sender.calledUserId);
        assertEquals("{}", new String(sender.calledPayload, StandardCharsets.UTF_8));
    }

    @Test
    void testHandleSend_InternalError() {
        RuntimeException myError = new StoreException("Test error", new IllegalStateException("redis down"));

        ResponseEntity<byte[]> response = gateway.handleSend(new SenderStub(myError), new AutherStub(1), post(), null);

        assertEquals(500, response.getStatusCode().value());
        assertFalse(body(response).contains("Test error"));
        assertFalse(body(response).contains("redis down"));
    }

    @Test
    void testHandleSend_InvalidPayload() {
        ResponseEntity<byte[]> response = gateway.handleSend(
                new SenderStub(IccException.invalid("message needs a name")), new AutherStub(1), post(), new byte[0]);

        assertEquals(400, response.getStatusCode().value());
        assertTrue(body(response).contains("message needs a name"));
    }

    @Test
    void testHandleSend_RejectedCredentials() {
        Authenticator auther = request -> {
            throw IccException.notAllowed("Invalid access token");
        };
        SenderStub sender = new SenderStub(null);

        ResponseEntity<byte[]> response = gateway.handleSend(sender, auther, post(), new byte[0]);

        assertEquals(401, response.getStatusCode().value());
        assertFalse(sender.called);
    }

    private ResponseEntity<byte[]> receive(Receiver receiver, Authenticator auther) {
        DeferredResult<ResponseEntity<byte[]>> result = gateway.handleReceive(receiver, auther, new MockHttpServletRequest());
        assertTrue(result.hasResult());
        @SuppressWarnings("unchecked")
        ResponseEntity<byte[]> response = (ResponseEntity<byte[]>) result.getResult();
        return response;
    }

    private static MockHttpServletRequest post() {
        return new MockHttpServletRequest("POST", "/system/icc/send");
    }

    private static String body(ResponseEntity<byte[]> response) {
        return response.getBody() == null ? "" : new String(response.getBody(), StandardCharsets.UTF_8);
    }

    static class AutherStub implements Authenticator {

        private final long userId;

        AutherStub(long userId) {
            this.userId = userId;
        }

        @Override
        public AuthContext authenticate(jakarta.servlet.http.HttpServletRequest request) {
            return new AuthContext(userId);
        }
    }

    static class ReceiverStub implements Receiver {

        private final String message;
        private final RuntimeException error;
        boolean called;

        ReceiverStub(String message, RuntimeException error) {
            this.message = message;
            this.error = error;
        }

        @Override
        public byte[] receive(CancelSignal cancel) {
            called = true;
            if (error != null) {
                throw error;
            }
            return message.getBytes(StandardCharsets.UTF_8);
        }
    }

    static class SenderStub implements Sender {

        private final RuntimeException error;
        boolean called;
        long calledUserId;
        byte[] calledPayload;

        SenderStub(RuntimeException error) {
            this.error = error;
        }

        @Override
        public void send(long userId, byte[] payload) {
            called = true;
            calledUserId = userId;
            calledPayload = payload;
            if (error != null) {
                throw error;
            }
        }
    }
}
