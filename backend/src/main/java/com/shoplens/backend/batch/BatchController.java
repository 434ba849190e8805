package com.shoplens.backend.batch;

import com.shoplens.backend.model.dto.BatchAnalyzeRequestDTO;
import com.shoplens.backend.model.dto.BatchStatusDTO;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/batch")
@RequiredArgsConstructor
public class BatchController {

    private final BatchService batchService;

    @PostMapping("/analyze")
    public ResponseEntity<BatchStatusDTO> submit(@Valid @RequestBody BatchAnalyzeRequestDTO request) {
        log.info("Batch analysis requested for {} URLs", request.getUrls().size());
        return ResponseEntity.accepted().body(batchService.submit(request.getUrls(), request.getName()));
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<BatchStatusDTO> get(@PathVariable String batchId) {
        return ResponseEntity.ok(batchService.get(batchId));
    }

    @GetMapping("/{batchId}/items")
    public ResponseEntity<Map<String, Object>> items(@PathVariable String batchId) {
        return ResponseEntity.ok(Map.of("items", batchService.items(batchId)));
    }
}
