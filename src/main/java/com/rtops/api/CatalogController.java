package com.rtops.api;

import com.rtops.catalog.CatalogQueryService;
import com.rtops.catalog.CatalogStatus;
import com.rtops.domain.TacticGroup;
import com.rtops.ingestion.ImportOrchestrator;
import com.rtops.ingestion.ImportReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Technique catalog API consumed by the catalog browser, plan builder and
 * report screens.
 *
 * Note: authn/authz is expected to be enforced by upstream security layers.
 */
@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private final CatalogQueryService queryService;
    private final ImportOrchestrator importOrchestrator;

    public CatalogController(CatalogQueryService queryService, ImportOrchestrator importOrchestrator) {
        this.queryService = queryService;
        this.importOrchestrator = importOrchestrator;
    }

    @GetMapping
    public List<TacticGroup> listCatalog(@RequestParam(name = "q", required = false) String query) {
        return queryService.listGroupedByTactic(query);
    }

    @GetMapping("/status")
    public CatalogStatus status() {
        return queryService.getStatus();
    }

    @PostMapping("/import")
    public ImportReport triggerImport() {
        return importOrchestrator.runImport();
    }
}
