package com.example.identityapi.service;

import com.example.identityapi.entity.Country;
import com.example.identityapi.repository.CountryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Country reference data, seeded by migration.
 */
@Service
@Transactional(readOnly = true)
public class CountryService {

    private final CountryRepository countryRepository;

    public CountryService(CountryRepository countryRepository) {
        this.countryRepository = countryRepository;
    }

    public List<Country> getCountries() {
        return countryRepository.findAllByOrderByNameAsc();
    }

    public Optional<Country> findCountryById(Integer id) {
        if (id == null) {
            return Optional.empty();
        }
        return countryRepository.findById(id);
    }
}
