package com.example.shortlink.util;

import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Base62 인코딩/디코딩 유틸리티
 *
 * 0-9, A-Z, a-z 62개 문자를 무작위 순서로 섞은 문자셋을 사용하여
 * 연속된 카운터 값이 서로 무관해 보이는 코드로 변환되도록 한다.
 * 문자셋을 바꾸면 이미 발급된 코드를 디코딩할 수 없으므로 배포 기간 동안 고정한다.
 */
@Component
public class Base62Encoder {

    // 섞인 Base62 문자셋 (표준 0-9A-Za-z 순서가 아님)
    static final String ALPHABET = "RO9zDGxetiA5flHnXvU8M1WmJNqwhK6TaSVQjgPkIsFbc04pL7yoCurBdEZ32Y";
    private static final int BASE = 62;

    /** 발급되는 단축 코드 길이 */
    public static final int CODE_LENGTH = 6;

    /** 6자리로 인코딩되는 최솟값 (62^5) */
    public static final long MIN_SIX_SYMBOL_VALUE = 916_132_832L;

    /** 6자리로 인코딩되는 최댓값 (62^6 - 1), 이를 넘으면 7자리 코드가 된다 */
    public static final long MAX_SIX_SYMBOL_VALUE = 56_800_235_583L;

    /**
     * 숫자를 Base62 문자열로 인코딩 (패딩 없음)
     *
     * @param number 인코딩할 숫자
     * @return 인코딩된 문자열, 음수이면 empty
     */
    public Optional<String> encode(long number) {
        if (number < 0) {
            return Optional.empty();
        }
        if (number == 0) {
            return Optional.of(String.valueOf(ALPHABET.charAt(0)));
        }

        StringBuilder sb = new StringBuilder();
        long num = number;
        while (num > 0) {
            sb.append(ALPHABET.charAt((int) (num % BASE)));
            num /= BASE;
        }

        return Optional.of(sb.reverse().toString());
    }

    /**
     * Base62 문자열을 숫자로 디코딩
     *
     * @param encoded Base62 인코딩된 문자열
     * @return 디코딩된 숫자
     * @throws IllegalArgumentException 비어 있거나, 잘못된 문자가 있거나, long 범위를 넘는 경우
     */
    public long decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException("인코딩된 문자열이 null이거나 비어있습니다");
        }

        long result = 0;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int index = ALPHABET.indexOf(c);

            if (index == -1) {
                throw new IllegalArgumentException("잘못된 Base62 문자: " + c);
            }

            try {
                result = Math.addExact(Math.multiplyExact(result, BASE), index);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("long 범위를 넘는 Base62 문자열: " + encoded, e);
            }
        }

        return result;
    }

    /**
     * 발급 가능한 단축 코드 형식인지 확인 (정확히 6자리, 문자셋 내 문자만)
     */
    public boolean isValidShortCode(String shortCode) {
        if (shortCode == null || shortCode.length() != CODE_LENGTH) {
            return false;
        }

        for (char c : shortCode.toCharArray()) {
            if (ALPHABET.indexOf(c) == -1) {
                return false;
            }
        }

        return true;
    }
}
