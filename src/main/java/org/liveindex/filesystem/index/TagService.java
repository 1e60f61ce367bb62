package org.liveindex.filesystem.index;

import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagMutationResult;

/**
 * 标签维护入口：参数校验后交给 {@link IndexMutationPipeline}。
 */
public class TagService {

    private final IndexMutationPipeline pipeline;

    public TagService(IndexMutationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * @throws IllegalArgumentException path/key/value 缺失
     * @throws org.liveindex.filesystem.EntryNotFoundException 条目不存在
     */
    public TagMutationResult add(String path, String key, String value) {
        Tag tag = validate(path, key, value);
        boolean changed = pipeline.addTag(tag);
        return new TagMutationResult(tag.path(), tag.key(), tag.value(), changed);
    }

    public TagMutationResult remove(String path, String key, String value) {
        Tag tag = validate(path, key, value);
        boolean changed = pipeline.removeTag(tag);
        return new TagMutationResult(tag.path(), tag.key(), tag.value(), changed);
    }

    private static Tag validate(String path, String key, String value) {
        if (isBlank(path) || isBlank(key) || isBlank(value)) {
            throw new IllegalArgumentException("参数错误：path、key、value 均不能为空");
        }
        return new Tag(path, key, value);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
