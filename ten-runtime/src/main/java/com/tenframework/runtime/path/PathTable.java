package com.tenframework.runtime.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.tenframework.runtime.message.CommandResult;
import lombok.extern.slf4j.Slf4j;
import org.agrona.collections.Long2ObjectHashMap;

/**
 * 路径表，用于管理在途命令的生命周期和结果回溯。
 * 对应C语言中的ten_path_table_t结构。只由 Engine 线程访问，不加锁。
 */
@Slf4j
public class PathTable {

    private final Long2ObjectHashMap<PathOut> outPaths = new Long2ObjectHashMap<>();

    /**
     * @return commandId 已存在时返回 false，表中内容不变
     */
    public boolean addOutPath(PathOut pathOut) {
        if (pathOut == null || pathOut.getCommandId() == 0) {
            log.warn("尝试添加空的或无效的PathOut到路径表");
            return false;
        }
        if (outPaths.containsKey(pathOut.getCommandId())) {
            return false;
        }
        outPaths.put(pathOut.getCommandId(), pathOut);
        log.debug("PathOut已添加: {}", pathOut);
        return true;
    }

    public Optional<PathOut> getOutPath(long commandId) {
        return Optional.ofNullable(outPaths.get(commandId));
    }

    /**
     * 按 in_response_to 查找结果所属的路径。非最终结果不计数；
     * 最终结果计数达到期望值时路径被移除，之后同一命令的结果都将查不到。
     *
     * @return 路径不存在（StaleResult）时返回 null
     */
    public ResultResolution resolveResult(CommandResult result) {
        PathOut pathOut = outPaths.get(result.getInResponseTo());
        if (pathOut == null) {
            return null;
        }
        boolean completes = result.isFinal() && pathOut.recordFinalResult();
        if (completes) {
            outPaths.remove(pathOut.getCommandId());
            log.debug("PathOut已结清: {}", pathOut);
        }
        return new ResultResolution(pathOut, completes);
    }

    /**
     * 移除并返回所有在途路径，用于 Engine 停止时的放弃处理。
     */
    public List<PathOut> removeAll() {
        List<PathOut> removed = new ArrayList<>(outPaths.values());
        outPaths.clear();
        if (!removed.isEmpty()) {
            log.info("路径表已清空，放弃 {} 个在途命令", removed.size());
        }
        return removed;
    }

    public int getOutPathCount() {
        return outPaths.size();
    }
}
