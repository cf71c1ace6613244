package com.flamingo.ai.chunker.api.rest;

import com.flamingo.ai.chunker.service.chunking.DocumentChunkingService;
import com.flamingo.ai.chunker.service.model.Chunk;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller exposing document chunking. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class ChunkController {

  private final DocumentChunkingService chunkingService;

  /** Splits an uploaded Word or PDF document into chunks. */
  @PostMapping(value = "/chunks", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<Chunk>> chunkDocument(@RequestParam("file") MultipartFile file)
      throws IOException {
    List<Chunk> chunks =
        chunkingService.chunk(file.getBytes(), file.getOriginalFilename(), file.getContentType());
    return ResponseEntity.ok(chunks);
  }
}
