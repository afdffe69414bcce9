package com.example.shortlink.exception;

import lombok.Getter;

@Getter
public class LinkNotFoundException extends ShortLinkException {

    private final String shortCode;

    public LinkNotFoundException(String shortCode) {
        super("존재하지 않는 단축 URL입니다: " + shortCode);
        this.shortCode = shortCode;
    }
}
