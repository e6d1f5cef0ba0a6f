package com.example.icc.controller;

import com.example.icc.auth.Authenticator;
import com.example.icc.service.ApplauseService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

@RestController
public class ApplauseController {

    private final LongPollGateway gateway;
    private final ApplauseService applauseService;
    private final Authenticator authenticator;

    public ApplauseController(LongPollGateway gateway, ApplauseService applauseService, Authenticator authenticator) {
        this.gateway = gateway;
        this.applauseService = applauseService;
        this.authenticator = authenticator;
    }

    @GetMapping("/system/icc/applause")
    public DeferredResult<ResponseEntity<byte[]>> receive(HttpServletRequest request) {
        return gateway.handleReceive(applauseService, authenticator, request);
    }

    @PostMapping("/system/icc/applause/send")
    public ResponseEntity<byte[]> send(HttpServletRequest request, @RequestBody(required = false) byte[] body) {
        return gateway.handleSend(applauseService, authenticator, request, body);
    }
}
