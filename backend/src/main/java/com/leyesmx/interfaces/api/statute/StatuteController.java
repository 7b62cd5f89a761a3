package com.leyesmx.interfaces.api.statute;

import com.leyesmx.application.statute.StatuteAppService;
import com.leyesmx.domain.statute.model.ParseResult;
import com.leyesmx.interfaces.api.dto.ParseRequest;
import com.leyesmx.interfaces.api.dto.ParseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/statutes")
@RequiredArgsConstructor
public class StatuteController {

    private final StatuteAppService statuteAppService;

    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        ParseResult result = statuteAppService.parse(
                request.documentId(),
                request.text(),
                request.splitLevel(),
                request.discardEmptyChapters());

        return ResponseEntity.ok(ParseResponse.from(result));
    }
}
