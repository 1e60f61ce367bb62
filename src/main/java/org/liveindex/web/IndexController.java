package org.liveindex.web;

import org.liveindex.filesystem.IndexLifecycle;
import org.liveindex.filesystem.dto.EntryDetail;
import org.liveindex.filesystem.dto.IndexStatus;
import org.liveindex.filesystem.dto.Suggestion;
import org.liveindex.filesystem.dto.TreeResult;
import org.liveindex.filesystem.index.IndexQueryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 目录树、条目、搜索与状态接口。
 */
@RestController
@RequestMapping("/api")
public class IndexController {

    private final IndexQueryService queries;
    private final IndexLifecycle lifecycle;

    public IndexController(IndexQueryService queries, IndexLifecycle lifecycle) {
        this.queries = queries;
        this.lifecycle = lifecycle;
    }

    @GetMapping("/tree")
    public TreeResult tree() {
        return queries.tree();
    }

    @GetMapping("/entry")
    public Map<String, EntryDetail> entry(@RequestParam(required = false) String path) {
        return Map.of("entry", queries.entry(path));
    }

    @GetMapping("/search")
    public Map<String, List<EntryDetail>> search(@RequestParam(name = "q", required = false) String query,
                                                 @RequestParam(required = false) String tags) {
        return Map.of("results", queries.search(query, IndexQueryService.parseTagFilters(tags)));
    }

    @GetMapping("/suggestions")
    public Map<String, List<Suggestion>> suggestions(@RequestParam(name = "q", required = false) String query) {
        return Map.of("suggestions", queries.suggest(query));
    }

    @GetMapping("/status")
    public IndexStatus status() {
        return lifecycle.status();
    }
}
