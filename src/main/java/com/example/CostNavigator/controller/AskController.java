package com.example.CostNavigator.controller;

import com.example.CostNavigator.model.AskRequest;
import com.example.CostNavigator.model.AskResponse;
import com.example.CostNavigator.service.NavigatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AskController {

    private final NavigatorService navigatorService;

    /**
     * Example:
     *   POST /api/ask
     *   { "question": "Who is cheapest for DRG 470 within 25 miles of 10001?" }
     */
    @PostMapping("/ask")
    public AskResponse ask(@RequestBody AskRequest request) {
        return navigatorService.ask(request);
    }
}
