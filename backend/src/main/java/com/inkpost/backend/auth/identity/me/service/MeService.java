package com.inkpost.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.identity.me.dto.MeResponse;
import com.inkpost.backend.auth.repo.UserRepository;
import com.inkpost.backend.global.ApiException;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public MeResponse me(AuthPrincipal principal) {

        if (principal == null || principal.userId() == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        // 토큰은 유효해도 계정이 사라졌을 수 있다
        User user = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        return new MeResponse(user.getId(), user.getEmail(), user.getNickname());
    }
}
