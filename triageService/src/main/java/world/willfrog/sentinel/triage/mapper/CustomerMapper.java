package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.sentinel.common.pojo.triage.Customer;

@Mapper
public interface CustomerMapper {

    /**
     * 查询客户画像，同时带出名下卡片与账户。
     */
    Customer findProfileById(@Param("id") String id);
}
