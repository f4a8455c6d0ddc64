package com.flagship.account_service.home;

import com.flagship.account_service.account.AccountController;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service banner at the root URL.
 */
@RestController
public class IndexController {

    static final String SERVICE_NAME = "Account REST API Service";
    static final String SERVICE_VERSION = "1.0";

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> index() {
        String baseUrl = ServletUriComponentsBuilder.fromCurrentContextPath().toUriString();

        Map<String, String> paths = new LinkedHashMap<>();
        paths.put("accounts", baseUrl + AccountController.BASE_PATH);
        paths.put("health", baseUrl + "/health");

        Map<String, Object> banner = new LinkedHashMap<>();
        banner.put("name", SERVICE_NAME);
        banner.put("version", SERVICE_VERSION);
        banner.put("paths", paths);
        return ResponseEntity.ok(banner);
    }
}
