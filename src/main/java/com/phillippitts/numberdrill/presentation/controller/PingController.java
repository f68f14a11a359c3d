package com.phillippitts.numberdrill.presentation.controller;

import com.phillippitts.numberdrill.domain.Language;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

/**
 * Liveness endpoint; also lists the languages the numeral core speaks.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "languages", Arrays.stream(Language.values()).map(Language::code).toList(),
                "timestamp", Instant.now().toString()
        ));
    }
}
