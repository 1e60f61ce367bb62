package org.liveindex.mcp;

import org.liveindex.filesystem.IndexLifecycle;
import org.liveindex.filesystem.content.FileContentService;
import org.liveindex.filesystem.dto.EntryDetail;
import org.liveindex.filesystem.dto.FileLineMatch;
import org.liveindex.filesystem.dto.IndexStatus;
import org.liveindex.filesystem.dto.Suggestion;
import org.liveindex.filesystem.dto.TagMutationResult;
import org.liveindex.filesystem.dto.TreeResult;
import org.liveindex.filesystem.index.IndexQueryService;
import org.liveindex.filesystem.index.TagService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 索引 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>浏览目录树与单个条目（{@code index_tree} / {@code index_entry}）。</li>
 *   <li>按名称/路径模糊搜索并按标签过滤（{@code index_search}），以及搜索框联想（{@code index_suggest}）。</li>
 *   <li>文件内搜索（{@code index_file_search}）。</li>
 *   <li>标签维护（{@code index_tag_add} / {@code index_tag_remove}）。</li>
 * </ul>
 * 所有路径都是索引根目录下的规范路径，例如 {@code /src/a.txt}；根目录为 {@code /}。
 */
@Component
public class IndexMcpTools {

    private final IndexQueryService queries;
    private final TagService tags;
    private final FileContentService content;
    private final IndexLifecycle lifecycle;

    public IndexMcpTools(IndexQueryService queries, TagService tags, FileContentService content, IndexLifecycle lifecycle) {
        this.queries = queries;
        this.tags = tags;
        this.content = content;
        this.lifecycle = lifecycle;
    }

    @Tool(
            name = "index_tree",
            description = "返回整棵索引目录树（目录在前、按名称排序；每个节点带标签与 Git 仓库信息）。"
    )
    /**
     * 目录很大时返回体也会很大，只需要定位文件时优先使用 {@code index_search}。
     */
    public TreeResult tree() {
        return queries.tree();
    }

    @Tool(
            name = "index_entry",
            description = "按规范路径（例如 /src/a.txt）查询单个条目，包含标签与 Git 仓库信息。"
    )
    public EntryDetail entry(
            @ToolParam(description = "规范路径，以 / 开头；根目录为 /") String path
    ) {
        return queries.entry(path);
    }

    @Tool(
            name = "index_search",
            description = "按名称/路径模糊搜索条目，可用 key:value 标签过滤（多个用逗号分隔，必须同时满足）。"
    )
    public List<EntryDetail> search(
            @ToolParam(required = false, description = "搜索关键字（为空时按索引顺序返回，仅应用标签过滤）") String query,
            @ToolParam(required = false, description = "标签过滤，例如 project:alpha,status:done") String tags
    ) {
        return queries.search(query, IndexQueryService.parseTagFilters(tags));
    }

    @Tool(
            name = "index_suggest",
            description = "搜索框联想：路径、标签（key:value）与标签名（key:）。输入以 key: 结尾时返回该标签的已知取值。"
    )
    public List<Suggestion> suggest(
            @ToolParam(required = false, description = "当前输入内容") String query
    ) {
        return queries.suggest(query);
    }

    @Tool(
            name = "index_file_search",
            description = "在单个文件内按行模糊搜索，返回行号、分数与片段。"
    )
    public List<FileLineMatch> fileSearch(
            @ToolParam(description = "文件规范路径") String path,
            @ToolParam(description = "搜索内容") String query
    ) {
        return content.search(path, query, null);
    }

    @Tool(
            name = "index_tag_add",
            description = "给条目添加标签（key:value）。重复添加不会产生重复标签。"
    )
    public TagMutationResult addTag(
            @ToolParam(description = "条目规范路径") String path,
            @ToolParam(description = "标签名") String key,
            @ToolParam(description = "标签值") String value
    ) {
        return tags.add(path, key, value);
    }

    @Tool(
            name = "index_tag_remove",
            description = "删除条目上的标签；标签不存在时什么也不做。"
    )
    public TagMutationResult removeTag(
            @ToolParam(description = "条目规范路径") String path,
            @ToolParam(description = "标签名") String key,
            @ToolParam(description = "标签值") String value
    ) {
        return tags.remove(path, key, value);
    }

    @Tool(
            name = "index_status",
            description = "索引运行状态：根目录、监听模式、git 是否可用、条目/标签数量等。"
    )
    public IndexStatus status() {
        return lifecycle.status();
    }
}
