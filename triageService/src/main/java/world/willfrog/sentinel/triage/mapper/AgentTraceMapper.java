package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.sentinel.triage.entity.AgentTrace;

import java.util.List;

@Mapper
public interface AgentTraceMapper {

    int insert(AgentTrace trace);

    List<AgentTrace> listByRunId(@Param("runId") String runId);
}
