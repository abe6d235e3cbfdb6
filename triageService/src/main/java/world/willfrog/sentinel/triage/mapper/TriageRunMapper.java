package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.sentinel.triage.entity.TriageRun;

@Mapper
public interface TriageRunMapper {

    int insert(TriageRun run);

    TriageRun findById(@Param("id") String id);

    /**
     * 写入最终决策并将状态置为 COMPLETED。
     */
    int finalizeRun(TriageRun run);

    int markFailed(@Param("id") String id,
                   @Param("lastError") String lastError,
                   @Param("latencyMs") long latencyMs);
}
