package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.sentinel.common.pojo.triage.Alert;

@Mapper
public interface AlertMapper {

    /**
     * 查询告警及其客户、可疑交易。
     *
     * @param id 告警 ID
     * @return 告警聚合，不存在时返回 null
     */
    Alert findAggregateById(@Param("id") String id);

    int updateStatus(@Param("id") String id, @Param("status") String status);
}
