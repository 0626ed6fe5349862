package com.mevshield.notification.controller;

import com.mevshield.common.model.Opportunity;
import com.mevshield.notification.sender.SlackWebhookSender;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    @PostMapping("/opportunity")
    public ResponseEntity<Void> notifyOpportunity(@RequestBody Opportunity opportunity) {
        slackSender.sendOpportunity(opportunity);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
