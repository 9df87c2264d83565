package com.example.ResearchGraph.controller;

import com.example.ResearchGraph.model.AskRequest;
import com.example.ResearchGraph.model.AskResponse;
import com.example.ResearchGraph.service.RagPipeline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/chat")
@RequiredArgsConstructor
public class ChatController {

    private final RagPipeline ragPipeline;

    /**
     * Ask a question about a specific paper. Returns a cached answer or generates one.
     * <pre>
     *   POST /chat
     *   {"paper_id": "2401.01234", "question": "Who are the authors?"}
     * </pre>
     */
    @PostMapping
    public AskResponse chat(@Valid @RequestBody AskRequest request) {
        return ragPipeline.ask(request.paperId(), request.question());
    }
}
