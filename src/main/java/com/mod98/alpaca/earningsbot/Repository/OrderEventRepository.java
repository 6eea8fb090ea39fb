package com.mod98.alpaca.earningsbot.Repository;

import com.mod98.alpaca.earningsbot.Model.OrderEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderEventRepository extends JpaRepository<OrderEvent, Long> {

    List<OrderEvent> findTop50ByOrderByCreatedAtDesc();
}
