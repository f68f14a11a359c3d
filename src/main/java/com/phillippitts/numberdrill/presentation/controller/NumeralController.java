package com.phillippitts.numberdrill.presentation.controller;

import com.phillippitts.numberdrill.domain.Language;
import com.phillippitts.numberdrill.presentation.dto.DecodeRequest;
import com.phillippitts.numberdrill.presentation.dto.DecodeResponse;
import com.phillippitts.numberdrill.presentation.dto.NumeralResponse;
import com.phillippitts.numberdrill.presentation.dto.ValidateRequest;
import com.phillippitts.numberdrill.presentation.dto.ValidateResponse;
import com.phillippitts.numberdrill.service.drill.NumeralDrillService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.OptionalLong;

/**
 * JSON facade over the numeral core for the practice UI.
 */
@RestController
@RequestMapping("/api")
class NumeralController {

    private final NumeralDrillService drillService;

    NumeralController(NumeralDrillService drillService) {
        this.drillService = drillService;
    }

    @GetMapping("/numerals/{value}")
    ResponseEntity<NumeralResponse> render(@PathVariable long value,
                                           @RequestParam(defaultValue = "ja") String language) {
        return ResponseEntity.ok(NumeralResponse.from(drillService.render(value, Language.fromCode(language))));
    }

    @PostMapping("/numerals/decode")
    ResponseEntity<DecodeResponse> decode(@Valid @RequestBody DecodeRequest request) {
        Language language = Language.fromCode(request.language());
        OptionalLong value = drillService.decode(request.text(), language);
        return ResponseEntity.ok(new DecodeResponse(
                request.text(),
                language.code(),
                value.isPresent(),
                value.isPresent() ? value.getAsLong() : null));
    }

    @PostMapping("/answers/validate")
    ResponseEntity<ValidateResponse> validate(@Valid @RequestBody ValidateRequest request) {
        Language language = Language.fromCode(request.language());
        return ResponseEntity.ok(ValidateResponse.from(drillService.check(
                request.userAnswer(), request.correctAnswer(), language, request.correctNumber())));
    }
}
