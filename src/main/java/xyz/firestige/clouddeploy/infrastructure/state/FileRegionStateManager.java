package xyz.firestige.clouddeploy.infrastructure.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.shared.exception.DeployerException;
import xyz.firestige.clouddeploy.domain.shared.exception.ErrorType;
import xyz.firestige.clouddeploy.domain.state.RegionCheck;
import xyz.firestige.clouddeploy.domain.state.RegionStateManager;
import xyz.firestige.clouddeploy.domain.state.RegionStateSnapshot;
import xyz.firestige.clouddeploy.domain.state.RestoreOutcome;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 基于文件的区域状态管理。
 * <pre>
 * terraform/&lt;provider&gt;/terraform.tfstate                      当前状态（infra 引擎所有）
 * terraform/&lt;provider&gt;/.region-states/current-region          当前状态所属区域
 * terraform/&lt;provider&gt;/.region-states/terraform.tfstate.&lt;region&gt;.&lt;yyyyMMdd-HHmmss&gt;[.partial]
 * </pre>
 * 非空状态但没有区域标记时归属未知，任何目标区域都视为冲突。
 */
public class FileRegionStateManager implements RegionStateManager {

    private static final Logger log = LoggerFactory.getLogger(FileRegionStateManager.class);

    public static final String STATE_FILE = "terraform.tfstate";
    public static final String STATES_DIR = ".region-states";
    public static final String MARKER_FILE = "current-region";
    public static final String UNKNOWN_REGION = "unknown";
    private static final String PREFIX = STATE_FILE + ".";
    private static final String PARTIAL = "partial";
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final Path terraformDir;
    private final ObjectMapper objectMapper;

    public FileRegionStateManager(Path terraformDir, ObjectMapper objectMapper) {
        this.terraformDir = terraformDir;
        this.objectMapper = objectMapper;
    }

    public Path stateFile() {
        return terraformDir.resolve(STATE_FILE);
    }

    public Path statesDir() {
        return terraformDir.resolve(STATES_DIR);
    }

    private Path markerFile() {
        return statesDir().resolve(MARKER_FILE);
    }

    @Override
    public Optional<String> currentRegion() {
        if (isStateEmpty()) {
            return Optional.empty();
        }
        return Optional.of(readMarker().orElse(UNKNOWN_REGION));
    }

    @Override
    public RegionCheck check(String targetRegion) {
        Optional<String> current = currentRegion();
        if (current.isEmpty()) {
            return RegionCheck.CLEAR;
        }
        if (current.get().equals(targetRegion)) {
            return RegionCheck.CURRENT;
        }
        log.warn("区域状态冲突: current={}, target={}", current.get(), targetRegion);
        return RegionCheck.CONFLICT;
    }

    @Override
    public RegionStateSnapshot snapshotFor(String region) {
        return copyState(region, false);
    }

    @Override
    public Optional<RegionStateSnapshot> snapshotPartial(String region) {
        if (!Files.isRegularFile(stateFile())) {
            log.info("apply 未产生状态文件，无部分状态可保存: region={}", region);
            return Optional.empty();
        }
        return Optional.of(copyState(region, true));
    }

    @Override
    public Optional<RegionStateSnapshot> snapshotAndClear() {
        if (isStateEmpty()) {
            clearStateFiles();
            clearMarker();
            return Optional.empty();
        }
        String region = readMarker().orElse(UNKNOWN_REGION);
        RegionStateSnapshot snapshot = copyState(region, false);
        clearStateFiles();
        clearMarker();
        log.info("当前状态已快照并清空: region={}, file={}", region, snapshot.file().getFileName());
        return Optional.of(snapshot);
    }

    @Override
    public RestoreOutcome restoreFor(String region) {
        Optional<RegionStateSnapshot> latest = list().stream()
                .filter(s -> s.region().equals(region))
                .max(Comparator.comparing(RegionStateSnapshot::timestamp));
        if (latest.isEmpty()) {
            return RestoreOutcome.NOT_FOUND;
        }
        RegionCheck check = check(region);
        if (check == RegionCheck.CURRENT) {
            log.info("目标区域已是当前状态: {}", region);
            return RestoreOutcome.RESTORED;
        }
        if (check == RegionCheck.CONFLICT) {
            snapshotAndClear();
        }
        try {
            Files.copy(latest.get().file(), stateFile(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Failed to restore state for region " + region, e);
        }
        markCurrent(region);
        log.info("已恢复区域状态: region={}, file={}", region, latest.get().file().getFileName());
        return RestoreOutcome.RESTORED;
    }

    @Override
    public List<RegionStateSnapshot> list() {
        Path dir = statesDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(this::parse)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(RegionStateSnapshot::timestamp)
                            .thenComparing(s -> s.file().getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot list region snapshots in " + dir, e);
        }
    }

    @Override
    public void markCurrent(String region) {
        try {
            Files.createDirectories(statesDir());
            Files.writeString(markerFile(), region + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot write region marker", e);
        }
    }

    @Override
    public void clearMarker() {
        try {
            Files.deleteIfExists(markerFile());
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot remove region marker", e);
        }
    }

    /**
     * 状态文件不存在、为空或 resources 为空数组时视为空状态；无法解析时按非空处理
     */
    boolean isStateEmpty() {
        Path state = stateFile();
        try {
            if (!Files.isRegularFile(state) || Files.size(state) == 0) {
                return true;
            }
            JsonNode root = objectMapper.readTree(state.toFile());
            JsonNode resources = root.path("resources");
            return resources.isMissingNode() || (resources.isArray() && resources.isEmpty());
        } catch (IOException e) {
            log.warn("状态文件无法解析，按非空处理: {}", e.getMessage());
            return false;
        }
    }

    private Optional<String> readMarker() {
        try {
            if (!Files.isRegularFile(markerFile())) {
                return Optional.empty();
            }
            String region = Files.readString(markerFile(), StandardCharsets.UTF_8).strip();
            return region.isEmpty() ? Optional.empty() : Optional.of(region);
        } catch (IOException e) {
            log.warn("区域标记无法读取: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private RegionStateSnapshot copyState(String region, boolean partial) {
        Path state = stateFile();
        if (!Files.isRegularFile(state)) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "No state file to snapshot at " + state);
        }
        LocalDateTime now = LocalDateTime.now().withNano(0);
        try {
            Files.createDirectories(statesDir());
            Path target = uniqueTarget(region, now, partial);
            Files.copy(state, target, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("区域状态快照: region={}, partial={}, file={}", region, partial, target.getFileName());
            return new RegionStateSnapshot(region, target, now, partial);
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Failed to snapshot state for region " + region, e);
        }
    }

    private Path uniqueTarget(String region, LocalDateTime ts, boolean partial) {
        String base = PREFIX + region + "." + TS.format(ts);
        String suffix = partial ? "." + PARTIAL : "";
        Path target = statesDir().resolve(base + suffix);
        int n = 1;
        while (Files.exists(target)) {
            target = statesDir().resolve(base + "-" + n++ + suffix);
        }
        return target;
    }

    private Optional<RegionStateSnapshot> parse(Path file) {
        String name = file.getFileName().toString();
        if (!name.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String[] parts = name.substring(PREFIX.length()).split("\\.");
        if (parts.length < 2 || parts[1].length() < 15) {
            return Optional.empty();
        }
        try {
            LocalDateTime ts = LocalDateTime.parse(parts[1].substring(0, 15), TS);
            boolean partial = parts.length > 2 && PARTIAL.equals(parts[2]);
            return Optional.of(new RegionStateSnapshot(parts[0], file, ts, partial));
        } catch (DateTimeParseException e) {
            log.debug("忽略无法识别的快照文件: {}", name);
            return Optional.empty();
        }
    }

    private void clearStateFiles() {
        try {
            Files.deleteIfExists(stateFile());
            Files.deleteIfExists(terraformDir.resolve(STATE_FILE + ".backup"));
        } catch (IOException e) {
            throw new DeployerException(ErrorType.SYSTEM_ERROR, "Cannot clear current state", e);
        }
    }
}
