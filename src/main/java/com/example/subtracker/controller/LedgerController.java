package com.example.subtracker.controller;

import com.example.subtracker.dto.GiftedSubsRequest;
import com.example.subtracker.dto.GifterUpdate;
import com.example.subtracker.dto.GifterUpdateResponse;
import com.example.subtracker.dto.SessionResponse;
import com.example.subtracker.exception.AuthException;
import com.example.subtracker.model.OAuthSession;
import com.example.subtracker.service.AuthorizationService;
import com.example.subtracker.service.LedgerService;
import com.example.subtracker.service.SseLiveUpdatePublisher;
import com.example.subtracker.util.Constants;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Optional;

/**
 * Ledger views for the broadcaster signed in on the current HTTP session.
 */
@RestController
@RequestMapping("/v1")
@Slf4j
public class LedgerController {

    private final AuthorizationService authorizationService;
    private final LedgerService ledgerService;
    private final SseLiveUpdatePublisher liveUpdatePublisher;

    public LedgerController(AuthorizationService authorizationService,
                            LedgerService ledgerService,
                            SseLiveUpdatePublisher liveUpdatePublisher) {
        this.authorizationService = authorizationService;
        this.ledgerService = ledgerService;
        this.liveUpdatePublisher = liveUpdatePublisher;
    }

    @GetMapping("/session")
    public ResponseEntity<SessionResponse> getSession(HttpSession httpSession) {
        OAuthSession session = restore(httpSession).orElse(OAuthSession.UNAUTHENTICATED);
        return ResponseEntity.ok(new SessionResponse(
                session.isAuthenticated(),
                session.broadcasterId(),
                session.isAuthenticated() ? null : authorizationService.authorizationUrl()));
    }

    @GetMapping("/gifters")
    public ResponseEntity<List<GifterUpdate>> getGifters(HttpSession httpSession) {
        String tenantId = requireBroadcaster(httpSession);
        log.info("Getting gifters: tenantId={}", tenantId);
        return ResponseEntity.ok(ledgerService.getGifters(tenantId));
    }

    @PutMapping("/gifters/{gifterId}")
    public ResponseEntity<GifterUpdateResponse> setGiftedSubs(@PathVariable String gifterId,
                                                              @Valid @RequestBody GiftedSubsRequest request,
                                                              HttpSession httpSession) {
        String tenantId = requireBroadcaster(httpSession);
        log.info("Setting gifted subs: tenantId={}, gifterId={}", tenantId, gifterId);
        GifterUpdate update = ledgerService.setGiftedSubs(tenantId, gifterId, request.userName(), request.giftedSubs());
        return ResponseEntity.ok(new GifterUpdateResponse(true, update));
    }

    @PostMapping("/gifters/{gifterId}/rewards")
    public ResponseEntity<GifterUpdateResponse> incrementRewards(@PathVariable String gifterId, HttpSession httpSession) {
        String tenantId = requireBroadcaster(httpSession);
        log.info("Incrementing rewards: tenantId={}, gifterId={}", tenantId, gifterId);
        GifterUpdate update = ledgerService.incrementRewards(tenantId, gifterId);
        return ResponseEntity.ok(new GifterUpdateResponse(true, update));
    }

    @GetMapping(path = "/updates", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeToUpdates(HttpSession httpSession) {
        String tenantId = requireBroadcaster(httpSession);
        log.info("Opening live update stream: tenantId={}", tenantId);
        return liveUpdatePublisher.subscribe(tenantId);
    }

    private String requireBroadcaster(HttpSession httpSession) {
        return restore(httpSession)
                .map(OAuthSession::broadcasterId)
                .orElseThrow(() -> new AuthException(Constants.ErrorMessages.NOT_AUTHORIZED));
    }

    private Optional<OAuthSession> restore(HttpSession httpSession) {
        Object token = httpSession.getAttribute(Constants.Session.ACCESS_TOKEN);
        Object broadcasterId = httpSession.getAttribute(Constants.Session.BROADCASTER_ID);
        if (!(token instanceof String) || !(broadcasterId instanceof String)) {
            return Optional.empty();
        }
        return authorizationService.restoreSession((String) token, (String) broadcasterId);
    }
}
