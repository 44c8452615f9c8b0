package com.inkpost.backend.security;

/**
 * Basic 헤더에서 디코딩한 자격증명 (로그인 요청 안에서만 쓰고 버린다)
 */
public record BasicCredential(String email, String password) {

    // 로그/예외 메시지에 비밀번호가 새지 않도록
    @Override
    public String toString() {
        return "BasicCredential[email=" + email + ", password=***]";
    }
}
