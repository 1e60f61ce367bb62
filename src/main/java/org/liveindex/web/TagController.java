package org.liveindex.web;

import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagSearchHit;
import org.liveindex.filesystem.index.IndexQueryService;
import org.liveindex.filesystem.index.TagService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 标签查询与维护接口。
 */
@RestController
@RequestMapping("/api/tags")
public class TagController {

    private final IndexQueryService queries;
    private final TagService tags;

    public TagController(IndexQueryService queries, TagService tags) {
        this.queries = queries;
        this.tags = tags;
    }

    @GetMapping
    public Map<String, List<Tag>> list(@RequestParam(required = false) String path) {
        return Map.of("tags", queries.tags(path));
    }

    @GetMapping("/search")
    public Map<String, List<TagSearchHit>> search(@RequestParam(name = "q", required = false) String query,
                                                  @RequestParam(required = false) Integer limit) {
        return Map.of("results", queries.searchTags(query, limit));
    }

    @PostMapping
    public Map<String, Boolean> add(@RequestBody(required = false) TagRequest request) {
        TagRequest body = request == null ? new TagRequest(null, null, null) : request;
        tags.add(body.path(), body.key(), body.value());
        return Map.of("success", true);
    }

    @DeleteMapping
    public Map<String, Boolean> remove(@RequestBody(required = false) TagRequest request) {
        TagRequest body = request == null ? new TagRequest(null, null, null) : request;
        tags.remove(body.path(), body.key(), body.value());
        return Map.of("success", true);
    }
}
