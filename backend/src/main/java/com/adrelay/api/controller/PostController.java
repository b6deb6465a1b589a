package com.adrelay.api.controller;

import com.adrelay.api.dto.ErrorBody;
import com.adrelay.api.dto.PostFailureRequest;
import com.adrelay.api.dto.ScheduledPostResponse;
import com.adrelay.campaign.ScheduledPostService;
import com.adrelay.domain.ScheduledPost;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Publisher endpoints: GET /posts/due, POST /posts/{id}/published, POST /posts/{id}/failed.
 * A post that is not SCHEDULED any more answers 409.
 */
@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
public class PostController {

    static final String POST_NOT_SCHEDULED = "POST_NOT_SCHEDULED";

    private final ScheduledPostService scheduledPostService;

    @GetMapping("/due")
    public ResponseEntity<List<ScheduledPostResponse>> due(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(scheduledPostService.findDueNow(limit).stream()
                .map(ScheduledPostResponse::from)
                .toList());
    }

    @PostMapping("/{postId}/published")
    public ResponseEntity<?> published(@PathVariable String postId) {
        return toResponse(postId, scheduledPostService.markPublished(postId));
    }

    @PostMapping("/{postId}/failed")
    public ResponseEntity<?> failed(@PathVariable String postId, @Valid @RequestBody PostFailureRequest request) {
        return toResponse(postId, scheduledPostService.markFailed(postId, request.reason()));
    }

    private ResponseEntity<?> toResponse(String postId, Optional<ScheduledPost> updated) {
        if (updated.isPresent()) {
            return ResponseEntity.ok(ScheduledPostResponse.from(updated.get()));
        }
        if (scheduledPostService.findPost(postId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorBody.of(POST_NOT_SCHEDULED, "Post " + postId + " is not scheduled"));
    }
}
