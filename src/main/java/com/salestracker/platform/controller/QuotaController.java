package com.salestracker.platform.controller;

import com.salestracker.platform.config.SalesTrackerProperties;
import com.salestracker.platform.dto.QuotaStats;
import com.salestracker.platform.service.NotificationQuotaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/quota")
public class QuotaController {

    private static final Logger logger = LoggerFactory.getLogger(QuotaController.class);

    private final NotificationQuotaManager quotaManager;
    private final SalesTrackerProperties properties;

    @Autowired
    public QuotaController(NotificationQuotaManager quotaManager, SalesTrackerProperties properties) {
        this.quotaManager = quotaManager;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<QuotaStats> getQuotaStats(@RequestParam(required = false) String category) {
        String resolved = category != null && !category.isBlank()
            ? category
            : properties.getNotifications().getActivityCategory();
        logger.info("Received GET request for quota stats - category: {}", resolved);
        return ResponseEntity.ok(quotaManager.getQuotaStats(resolved));
    }
}
