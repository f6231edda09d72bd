package com.seveninterprise.stackforge.controllers;

import com.seveninterprise.stackforge.dto.InstantiateTemplateRequest;
import com.seveninterprise.stackforge.model.Template;
import com.seveninterprise.stackforge.model.TemplateInstance;
import com.seveninterprise.stackforge.services.ITemplateService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for template operations
 * 
 * @author levi
 */
@RestController
@RequestMapping("/api/templates")
public class TemplateController implements ITemplateController {

    private final ITemplateService templateService;

    public TemplateController(ITemplateService templateService) {
        this.templateService = templateService;
    }

    @GetMapping
    @Override
    public ResponseEntity<List<Template>> listTemplates() {
        return ResponseEntity.ok(templateService.listTemplates());
    }

    @GetMapping("/{name}")
    @Override
    public ResponseEntity<Template> getTemplate(@PathVariable String name) {
        Template template = templateService.getTemplateByName(name);
        
        if (template == null) {
            return ResponseEntity.notFound().build();
        }
        
        return ResponseEntity.ok(template);
    }

    @PostMapping("/{name}/instances")
    @Override
    public ResponseEntity<TemplateInstance> instantiateTemplate(@PathVariable String name,
                                                                @Valid @RequestBody(required = false) InstantiateTemplateRequest request) {
        String suffix = request != null ? request.getSuffix() : null;
        TemplateInstance instance = templateService.instantiateTemplate(name, suffix);
        return ResponseEntity.status(HttpStatus.CREATED).body(instance);
    }
}
