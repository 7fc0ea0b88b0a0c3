package com.flagship.missed_call.auth;

import com.flagship.missed_call.auth.dto.MagicLinkRequest;
import com.flagship.missed_call.ratelimit.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Answers {"success":true} for every well-formed address: known or unknown,
 * throttled or not.
 */
@RestController
@RequestMapping("/api/auth/magic-link")
@RequiredArgsConstructor
public class MagicLinkController {

    private final MagicLinkService magicLinkService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> requestLink(@Valid @RequestBody MagicLinkRequest body,
                                                           HttpServletRequest request) {
        magicLinkService.requestLink(body.getEmail(), ClientIpResolver.resolve(request));
        return ResponseEntity.ok(Map.of("success", true));
    }
}
