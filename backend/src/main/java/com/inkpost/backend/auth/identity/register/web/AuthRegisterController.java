package com.inkpost.backend.auth.identity.register.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.inkpost.backend.auth.identity.register.dto.RegisterRequest;
import com.inkpost.backend.auth.identity.register.service.RegisterService;
import com.inkpost.backend.auth.token.dto.TokenPair;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/register")
public class AuthRegisterController {

    private final RegisterService registerService;

    /**
     * POST /auth/register/email
     * { "email": "a@b.com", "nickname": "A", "password": "pw" } -> 201 { accessToken, refreshToken }
     */
    @PostMapping("/email")
    @ResponseStatus(HttpStatus.CREATED)
    public TokenPair registerWithEmail(@Valid @RequestBody RegisterRequest req) {
        return registerService.register(req.email(), req.nickname(), req.password());
    }
}
