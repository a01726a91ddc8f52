package com.soundledger.web.adapter.driving.http.util;

import com.soundledger.domain.model.DomainValidator;
import com.soundledger.domain.model.royalty.AccountingPeriod;
import jakarta.servlet.ServletException;
import org.springframework.web.servlet.function.ServerRequest;

import java.io.IOException;
import java.util.Optional;

public class HttpUtil {
    private HttpUtil() {
    }

    public static <T> T parseAndValidateBody(ServerRequest req, Class<T> clazz) throws ServletException, IOException {
        var body = req.body(clazz);
        return DomainValidator.assertValid(body);
    }

    public static AccountingPeriod parsePeriod(String raw) {
        return AccountingPeriod.parse(raw); // expects yyyy-Qn or Qn yyyy
    }

    public static Optional<String> optionalParam(ServerRequest req, String name) {
        return req.param(name)
                .map(String::trim)
                .filter(s -> !s.isBlank());
    }

    public static int intParam(ServerRequest req, String name, int defaultValue) {
        return optionalParam(req, name)
                .map(raw -> parseInt(name, raw))
                .orElse(defaultValue);
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter %s must be a whole number".formatted(name));
        }
    }
}
