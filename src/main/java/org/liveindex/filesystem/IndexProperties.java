package org.liveindex.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.liveindex.filesystem.watch.WatchMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 实时索引服务的业务配置（{@code app.index.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #root} 指定被索引的根目录；索引只存在于内存中，每次启动都会重新扫描。</li>
 *   <li>{@link #initialWatchMode} 决定启动时的监听方式；原生监听资源耗尽时会自动降级为轮询。</li>
 *   <li>git 相关配置控制仓库元数据采集的开销（超时、输出上限、并发数）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.index")
public class IndexProperties {

    /**
     * 被索引的根目录（默认当前工作目录；可通过环境变量 START_PATH 覆盖）。
     */
    @NotBlank
    private String root = ".";

    /**
     * 是否在初始扫描后持续监听文件变化。
     */
    private boolean watchEnabled = true;

    /**
     * 启动时的监听模式：native / polling。
     */
    @NotNull
    private WatchMode initialWatchMode = WatchMode.NATIVE;

    /**
     * 轮询模式下两次扫描之间的间隔。
     */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(5);

    /**
     * 是否进入符号链接指向的目录（默认不进入；进入时按真实路径防止循环）。
     */
    private boolean followSymlinks = false;

    /**
     * 始终忽略的路径后缀（大小写不敏感）。
     */
    @NotNull
    private List<String> ignoredSuffixes = List.of(".sock");

    /**
     * 条目搜索最多返回的结果数。
     */
    @Min(1)
    @Max(10_000)
    private int searchLimit = 50;

    /**
     * 搜索框联想最多返回的条数。
     */
    @Min(1)
    @Max(1_000)
    private int suggestionLimit = 10;

    /**
     * 文件内搜索最多返回的匹配行数。
     */
    @Min(1)
    @Max(10_000)
    private int fileSearchLimit = 50;

    /**
     * 文件内搜索片段的最大长度（找不到字面匹配时按此截断整行）。
     */
    @Min(16)
    @Max(100_000)
    private int snippetMaxLength = 240;

    /**
     * 是否采集 git 仓库元数据。
     */
    private boolean gitEnabled = true;

    /**
     * git 可执行文件（名称或绝对路径）。
     */
    @NotBlank
    private String gitBinary = "git";

    /**
     * 单次 git 调用的超时时间。
     */
    @NotNull
    private Duration gitTimeout = Duration.ofSeconds(5);

    /**
     * 单次 git 调用允许的最大输出（超过视为失败）。
     */
    @NotNull
    private DataSize gitMaxOutput = DataSize.ofMegabytes(2);

    /**
     * 并发执行 git 采集的线程数。
     */
    @Min(1)
    @Max(64)
    private int gitThreads = 4;

    /**
     * WebSocket 推送通道允许的来源。
     */
    @NotNull
    private List<String> websocketAllowedOrigins = List.of("*");

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    public WatchMode getInitialWatchMode() {
        return initialWatchMode;
    }

    public void setInitialWatchMode(WatchMode initialWatchMode) {
        this.initialWatchMode = initialWatchMode;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public List<String> getIgnoredSuffixes() {
        return ignoredSuffixes;
    }

    public void setIgnoredSuffixes(List<String> ignoredSuffixes) {
        this.ignoredSuffixes = ignoredSuffixes;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public void setSearchLimit(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    public int getSuggestionLimit() {
        return suggestionLimit;
    }

    public void setSuggestionLimit(int suggestionLimit) {
        this.suggestionLimit = suggestionLimit;
    }

    public int getFileSearchLimit() {
        return fileSearchLimit;
    }

    public void setFileSearchLimit(int fileSearchLimit) {
        this.fileSearchLimit = fileSearchLimit;
    }

    public int getSnippetMaxLength() {
        return snippetMaxLength;
    }

    public void setSnippetMaxLength(int snippetMaxLength) {
        this.snippetMaxLength = snippetMaxLength;
    }

    public boolean isGitEnabled() {
        return gitEnabled;
    }

    public void setGitEnabled(boolean gitEnabled) {
        this.gitEnabled = gitEnabled;
    }

    public String getGitBinary() {
        return gitBinary;
    }

    public void setGitBinary(String gitBinary) {
        this.gitBinary = gitBinary;
    }

    public Duration getGitTimeout() {
        return gitTimeout;
    }

    public void setGitTimeout(Duration gitTimeout) {
        this.gitTimeout = gitTimeout;
    }

    public DataSize getGitMaxOutput() {
        return gitMaxOutput;
    }

    public void setGitMaxOutput(DataSize gitMaxOutput) {
        this.gitMaxOutput = gitMaxOutput;
    }

    public int getGitThreads() {
        return gitThreads;
    }

    public void setGitThreads(int gitThreads) {
        this.gitThreads = gitThreads;
    }

    public List<String> getWebsocketAllowedOrigins() {
        return websocketAllowedOrigins;
    }

    public void setWebsocketAllowedOrigins(List<String> websocketAllowedOrigins) {
        this.websocketAllowedOrigins = websocketAllowedOrigins;
    }
}
