package com.minerpayout.api.controller;

import com.minerpayout.api.dto.ShareSubmissionRequest;
import com.minerpayout.api.dto.ShareSubmissionResponse;
import com.minerpayout.domain.ShareAcceptedEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /shares: entry point for an out-of-process share source. Accrual happens asynchronously; the event is
 * published off the event loop since a saturated share executor runs the accrual on the publishing thread.
 */
@RestController
@RequestMapping("/api/v1/shares")
@RequiredArgsConstructor
public class ShareController {

    private final ApplicationEventPublisher applicationEventPublisher;

    @PostMapping
    public Mono<ResponseEntity<ShareSubmissionResponse>> submit(@RequestBody @Valid ShareSubmissionRequest request) {
        ShareAcceptedEvent event =
                new ShareAcceptedEvent(request.blockReference(), request.hash().trim(), request.difficulty());
        return Mono.fromRunnable(() -> applicationEventPublisher.publishEvent(event))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(ResponseEntity.accepted().body(new ShareSubmissionResponse("Share accepted")));
    }
}
