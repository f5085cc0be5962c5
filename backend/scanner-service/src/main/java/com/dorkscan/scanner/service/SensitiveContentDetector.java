package com.dorkscan.scanner.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class SensitiveContentDetector {

    private static final Pattern SENSITIVE = Pattern.compile(
            "password|passwd|pwd|aws_access_key_id|aws_secret_access_key|private key|BEGIN PRIVATE KEY|api_key|access_token",
            Pattern.CASE_INSENSITIVE);

    public boolean containsSensitive(String text) {
        return text != null && !text.isEmpty() && SENSITIVE.matcher(text).find();
    }
}
