package com.financemanager.catalog.dto.currency;

import jakarta.validation.constraints.Size;

public class CreateCurrencyRequest {

    @Size(max = 10, message = "Char code must be at most 10 characters")
    private String charCode;

    @Size(max = 10, message = "Num code must be at most 10 characters")
    private String numCode;

    @Size(max = 200, message = "Name must be at most 200 characters")
    private String name;

    private String sign;
    private String emoji;

    public CreateCurrencyRequest() {
    }

    public CreateCurrencyRequest(String charCode,
                                 String numCode,
                                 String name,
                                 String sign,
                                 String emoji) {
        this.charCode = charCode;
        this.numCode = numCode;
        this.name = name;
        this.sign = sign;
        this.emoji = emoji;
    }

    public String getCharCode() {
        return charCode;
    }

    public void setCharCode(String charCode) {
        this.charCode = charCode;
    }

    public String getNumCode() {
        return numCode;
    }

    public void setNumCode(String numCode) {
        this.numCode = numCode;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSign() {
        return sign;
    }

    public void setSign(String sign) {
        this.sign = sign;
    }

    public String getEmoji() {
        return emoji;
    }

    public void setEmoji(String emoji) {
        this.emoji = emoji;
    }
}
