package com.vuong.simpledata.fixture;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Entity keyed by a primitive {@code long}.
 */
@Entity
@Table(name = "counter")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CounterEntity {

    @Id
    private long id;

    private String label;
}
