package com.financemanager.catalog.domain;

import com.financemanager.common.domain.SoftDeletableEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Currency reference data.
 *
 * charCode (ISO 4217 alpha, e.g. RUB) and numCode (ISO 4217 numeric, e.g. 643)
 * are each unique ignoring case.
 */
@Entity
@Table(
    name = "currencies",
    indexes = {
        @Index(name = "idx_currencies_char_code", columnList = "char_code"),
        @Index(name = "idx_currencies_num_code", columnList = "num_code")
    }
)
public class Currency extends SoftDeletableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "char_code", nullable = false, length = 10)
    private String charCode;

    @Column(name = "num_code", nullable = false, length = 10)
    private String numCode;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(length = 10)
    private String sign;

    @Column(length = 20)
    private String emoji;

    protected Currency() {
    }

    public Currency(String charCode, String numCode, String name, String sign, String emoji) {
        this.charCode = charCode;
        this.numCode = numCode;
        this.name = name;
        this.sign = sign;
        this.emoji = emoji;
    }

    public UUID getId() {
        return id;
    }

    public String getCharCode() {
        return charCode;
    }

    public String getNumCode() {
        return numCode;
    }

    public String getName() {
        return name;
    }

    public String getSign() {
        return sign;
    }

    public String getEmoji() {
        return emoji;
    }

    public void changeCharCode(String charCode) {
        this.charCode = charCode;
    }

    public void changeNumCode(String numCode) {
        this.numCode = numCode;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeSign(String sign) {
        this.sign = sign;
    }

    public void changeEmoji(String emoji) {
        this.emoji = emoji;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Currency currency = (Currency) o;
        return id != null && Objects.equals(id, currency.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Currency{id=" + id + ", charCode='" + charCode + "', numCode='" + numCode +
                "', deleted=" + isDeleted() + '}';
    }
}
