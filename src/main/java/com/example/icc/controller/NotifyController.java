package com.example.icc.controller;

import com.example.icc.auth.Authenticator;
import com.example.icc.service.NotifyService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

@RestController
public class NotifyController {

    private final LongPollGateway gateway;
    private final NotifyService notifyService;
    private final Authenticator authenticator;

    public NotifyController(LongPollGateway gateway, NotifyService notifyService, Authenticator authenticator) {
        this.gateway = gateway;
        this.notifyService = notifyService;
        this.authenticator = authenticator;
    }

    @GetMapping("/system/icc")
    public DeferredResult<ResponseEntity<byte[]>> receive(HttpServletRequest request) {
        return gateway.handleReceive(notifyService, authenticator, request);
    }

    @PostMapping("/system/icc/send")
    public ResponseEntity<byte[]> send(HttpServletRequest request, @RequestBody(required = false) byte[] body) {
        return gateway.handleSend(notifyService, authenticator, request, body);
    }
}
