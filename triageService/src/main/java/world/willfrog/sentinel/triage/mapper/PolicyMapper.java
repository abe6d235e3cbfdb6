package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.sentinel.triage.entity.Policy;

import java.util.List;

@Mapper
public interface PolicyMapper {

    @Select("<script>" +
            "SELECT id, code, title, requires_approval FROM policy " +
            "WHERE code IN <foreach collection='codes' item='c' open='(' separator=',' close=')'>#{c}</foreach> " +
            "LIMIT #{limit}" +
            "</script>")
    List<Policy> listByCodes(@Param("codes") List<String> codes, @Param("limit") int limit);
}
