package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface CaseMapper {

    @Select("SELECT COUNT(*) FROM case_record WHERE customer_id = #{customerId} AND type = #{type}")
    long countByCustomerAndType(@Param("customerId") String customerId, @Param("type") String type);

    @Select("<script>" +
            "SELECT COUNT(*) FROM case_record " +
            "WHERE customer_id = #{customerId} " +
            "AND status IN <foreach collection='statuses' item='s' open='(' separator=',' close=')'>#{s}</foreach> " +
            "AND type IN <foreach collection='types' item='t' open='(' separator=',' close=')'>#{t}</foreach>" +
            "</script>")
    long countActive(@Param("customerId") String customerId,
                     @Param("statuses") List<String> statuses,
                     @Param("types") List<String> types);
}
