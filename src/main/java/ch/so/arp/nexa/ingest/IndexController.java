package ch.so.arp.nexa.ingest;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.nexa.index.IndexStats;

@RestController
@RequestMapping(path = "/api/index", produces = MediaType.APPLICATION_JSON_VALUE)
public class IndexController {

    private final IndexManagementService indexManagementService;

    public IndexController(IndexManagementService indexManagementService) {
        this.indexManagementService = indexManagementService;
    }

    @GetMapping("/stats")
    public IndexStats stats() {
        return indexManagementService.stats();
    }

    @PostMapping("/rebuild")
    public IndexStats rebuild() {
        return indexManagementService.rebuild();
    }

    @DeleteMapping
    public IndexStats clear() {
        return indexManagementService.clear();
    }
}
