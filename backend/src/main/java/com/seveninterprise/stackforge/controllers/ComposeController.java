package com.seveninterprise.stackforge.controllers;

import com.seveninterprise.stackforge.dto.RandomizedCompose;
import com.seveninterprise.stackforge.dto.RenameComposeRequest;
import com.seveninterprise.stackforge.services.IComposeRandomizerService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints para renomear arquivos docker-compose.yml enviados no corpo da requisição
 */
@RestController
@RequestMapping("/api/compose")
public class ComposeController {

    private final IComposeRandomizerService randomizerService;

    public ComposeController(IComposeRandomizerService randomizerService) {
        this.randomizerService = randomizerService;
    }

    /**
     * Renomeia todos os recursos do arquivo e devolve também o .env com o sufixo
     */
    @PostMapping("/randomize")
    public ResponseEntity<RandomizedCompose> randomize(@Valid @RequestBody RenameComposeRequest request) {
        RandomizedCompose result = randomizerService.randomizeComposeFile(request.getComposeFile(), request.getSuffix());
        result.setEnvContent(randomizerService.buildEnvContent(request.getEnv(), result.getSuffix()));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/rename/{kind}")
    public ResponseEntity<RandomizedCompose> rename(@PathVariable String kind,
                                                    @Valid @RequestBody RenameComposeRequest request) {
        return ResponseEntity.ok(randomizerService.renameComposeFile(request.getComposeFile(), kind, request.getSuffix()));
    }
}
