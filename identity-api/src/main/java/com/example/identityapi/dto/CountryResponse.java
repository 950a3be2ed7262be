package com.example.identityapi.dto;

import com.example.identityapi.entity.Country;

public record CountryResponse(Integer id, String name) {

    public static CountryResponse from(Country country) {
        return new CountryResponse(country.getId(), country.getName());
    }
}
