package com.salestracker.platform.controller;

import com.salestracker.platform.dto.DailyTrend;
import com.salestracker.platform.dto.Leaderboard;
import com.salestracker.platform.dto.TeamStats;
import com.salestracker.platform.dto.TypeBreakdown;
import com.salestracker.platform.model.LeaderboardPeriod;
import com.salestracker.platform.service.AggregationService;
import com.salestracker.platform.service.AnalyticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
public class TeamController {

    private static final Logger logger = LoggerFactory.getLogger(TeamController.class);

    private final AggregationService aggregationService;
    private final AnalyticsService analyticsService;

    @Autowired
    public TeamController(AggregationService aggregationService, AnalyticsService analyticsService) {
        this.aggregationService = aggregationService;
        this.analyticsService = analyticsService;
    }

    @GetMapping("/team/stats")
    public ResponseEntity<TeamStats> getTeamStats() {
        logger.info("Received GET request for team stats");
        return ResponseEntity.ok(aggregationService.getTeamStats());
    }

    /**
     * GET /api/leaderboard?period=daily|weekly|monthly&date=yyyy-MM-dd
     */
    @GetMapping("/leaderboard")
    public ResponseEntity<Leaderboard> getLeaderboard(
            @RequestParam(required = false) String period,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        logger.info("Received GET request for leaderboard - period: {}, date: {}", period, date);
        return ResponseEntity.ok(aggregationService.getLeaderboard(LeaderboardPeriod.fromValue(period), date));
    }

    @GetMapping("/analytics/trends")
    public ResponseEntity<List<DailyTrend>> getTrends(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "30") int days) {

        logger.info("Received GET request for trends - userId: {}, days: {}", userId, days);
        return ResponseEntity.ok(analyticsService.getTrends(userId, days));
    }

    @GetMapping("/analytics/breakdown")
    public ResponseEntity<List<TypeBreakdown>> getBreakdown(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "monthly") String period) {

        logger.info("Received GET request for breakdown - userId: {}, period: {}", userId, period);
        return ResponseEntity.ok(analyticsService.getBreakdown(userId, LeaderboardPeriod.fromValue(period)));
    }
}
