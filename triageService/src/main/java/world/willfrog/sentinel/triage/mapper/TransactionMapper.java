package world.willfrog.sentinel.triage.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import world.willfrog.sentinel.common.pojo.triage.Transaction;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface TransactionMapper {

    @Select("SELECT id, customer_id, card_id, mcc, merchant, amount_cents, currency, device_id, country, city, ts " +
            "FROM transaction " +
            "WHERE customer_id = #{customerId} AND ts >= #{since} " +
            "ORDER BY ts DESC " +
            "LIMIT #{limit}")
    List<Transaction> listRecentByCustomer(@Param("customerId") String customerId,
                                           @Param("since") OffsetDateTime since,
                                           @Param("limit") int limit);
}
