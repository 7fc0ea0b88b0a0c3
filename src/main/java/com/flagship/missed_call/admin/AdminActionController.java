package com.flagship.missed_call.admin;

import com.flagship.missed_call.admin.dto.AdminActionRequest;
import com.flagship.missed_call.admin.dto.AdminActionResponse;
import com.flagship.missed_call.auth.AdminAuthService;
import com.flagship.missed_call.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin actions on customer accounts. The admin cookie is checked before the
 * body is looked at.
 */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
public class AdminActionController {

    private final AdminAuthService authService;
    private final AdminActionService actionService;

    @PostMapping
    public ResponseEntity<AdminActionResponse> perform(
            @CookieValue(name = AdminAuthService.COOKIE_NAME, required = false) String adminCookie,
            @RequestBody AdminActionRequest request) {

        authService.requireAdmin(adminCookie);
        MDC.put(CorrelationContext.CUSTOMER_ID_MDC_KEY, String.valueOf(request.getCustomerId()));
        try {
            return ResponseEntity.ok(actionService.perform(request));
        } finally {
            MDC.remove(CorrelationContext.CUSTOMER_ID_MDC_KEY);
        }
    }
}
