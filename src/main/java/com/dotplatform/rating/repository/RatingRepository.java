package com.dotplatform.rating.repository;

import com.dotplatform.rating.entity.Rating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RatingRepository extends JpaRepository<Rating, Long> {

    boolean existsByOrderId(Long orderId);

    List<Rating> findByDriverIdOrderByCreatedAtDescIdDesc(Long driverId);

    List<Rating> findByCustomerIdOrderByCreatedAtDescIdDesc(Long customerId);

    @Query("SELECT AVG(r.score) FROM Rating r WHERE r.driverId = :driverId")
    Double findAverageScoreByDriverId(@Param("driverId") Long driverId);
}
