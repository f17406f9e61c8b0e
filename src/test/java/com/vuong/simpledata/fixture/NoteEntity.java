package com.vuong.simpledata.fixture;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Entity with a database-generated key and a column filled by a database default.
 */
@Entity
@Table(name = "note")
@Getter
@Setter
@NoArgsConstructor
public class NoteEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String body;

    @Column(insertable = false, updatable = false, columnDefinition = "varchar(32) default 'system'")
    private String author;

    public NoteEntity(String body) {
        this.body = body;
    }
}
