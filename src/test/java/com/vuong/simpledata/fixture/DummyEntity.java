package com.vuong.simpledata.fixture;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "dummy")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DummyEntity {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String name;
}
