package org.liveindex.web;

import org.liveindex.filesystem.content.FileContentService;
import org.liveindex.filesystem.dto.FileLineMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 文件内容接口：流式读取与文件内搜索。
 * <p>
 * 请求可携带 {@code X-Client-Id}：同一客户端的新请求会让旧的读取停止、旧的搜索返回 409。
 */
@RestController
@RequestMapping("/api/file")
public class FileController {

    private static final Logger log = LoggerFactory.getLogger(FileController.class);

    static final String CLIENT_ID_HEADER = "X-Client-Id";
    static final MediaType TEXT_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final FileContentService content;

    public FileController(FileContentService content) {
        this.content = content;
    }

    @GetMapping("/stream")
    public ResponseEntity<StreamingResponseBody> stream(@RequestParam(required = false) String path,
                                                        @RequestHeader(name = CLIENT_ID_HEADER, required = false) String clientId) {
        FileContentService.FileStream file = content.open(path, clientId);
        StreamingResponseBody body = out -> {
            try {
                content.copy(file, out);
            } catch (IOException e) {
                // 多数情况是客户端提前断开
                log.debug("文件发送中断：{}（{}）", file.path(), e.getMessage());
                throw e;
            }
        };
        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .contentType(TEXT_UTF8)
                .header("X-File-Path", file.path())
                .header("X-File-Mtime", String.valueOf(file.modifiedAt()));
        // 带客户端标识的读取可能被新请求打断，此时实际长度小于文件大小
        if (clientId == null || clientId.isBlank()) {
            response.contentLength(file.size());
        }
        return response.body(body);
    }

    @GetMapping("/search")
    public Map<String, List<FileLineMatch>> search(@RequestParam(required = false) String path,
                                                   @RequestParam(name = "q", required = false) String query,
                                                   @RequestHeader(name = CLIENT_ID_HEADER, required = false) String clientId) {
        return Map.of("matches", content.search(path, query, clientId));
    }
}
