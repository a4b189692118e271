package com.example.subtracker.controller;

import com.example.subtracker.model.OAuthSession;
import com.example.subtracker.service.AuthorizationService;
import com.example.subtracker.util.Constants;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@Slf4j
public class AuthorizationController {

    static final String AFTER_LOGIN_PATH = "/v1/session";

    private final AuthorizationService authorizationService;

    public AuthorizationController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @GetMapping("/authorize")
    public ResponseEntity<Void> authorize() {
        String url = authorizationService.authorizationUrl();
        log.info("Redirecting to Twitch authorization");
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(url)).build();
    }

    /**
     * OAuth redirect target. Shares its path with the EventSub callback, which Twitch POSTs to.
     */
    @GetMapping(Constants.Twitch.CALLBACK_PATH)
    public ResponseEntity<String> handleAuthorizationCallback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String error,
            @RequestParam(name = "error_description", required = false) String errorDescription,
            HttpSession httpSession) {

        if (error != null && !error.isEmpty()) {
            log.warn("Twitch authorization failed: error={}, description={}", error, errorDescription);
            return ResponseEntity.badRequest()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Error: " + error + ": " + errorDescription);
        }
        if (code == null || code.isEmpty()) {
            return ResponseEntity.badRequest()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Missing \"code\" argument.");
        }

        OAuthSession session = authorizationService.completeAuthorization(code);
        httpSession.setAttribute(Constants.Session.ACCESS_TOKEN, session.userToken());
        httpSession.setAttribute(Constants.Session.BROADCASTER_ID, session.broadcasterId());

        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(AFTER_LOGIN_PATH)).build();
    }
}
