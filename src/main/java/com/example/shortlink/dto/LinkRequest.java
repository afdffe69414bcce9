package com.example.shortlink.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkRequest {

    // 공백 문자열은 @NotBlank 메시지만 내도록 패턴에서 허용
    @NotBlank(message = "원본 URL은 필수입니다")
    @Size(max = 2048, message = "원본 URL은 2048자 이하여야 합니다")
    @Pattern(regexp = "^\\s*$|^https?://[^\\s/$.?#][^\\s]*$",
             flags = Pattern.Flag.CASE_INSENSITIVE,
             message = "올바른 URL 형식이 아닙니다 (http:// 또는 https://로 시작해야 합니다)")
    private String originalUrl;
}
