package com.nosota.landmarket.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * Local projection of identity data the marketplace needs.
 */
@Entity
@Table(name = "user_profile")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UserProfile {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "display_name", nullable = false)
    private String displayName;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    /**
     * Days until passive income of a newly acquired feature can be withdrawn.
     * Null means the service default.
     */
    @Column(name = "withdraw_profit_days")
    private Integer withdrawProfitDays;
}
