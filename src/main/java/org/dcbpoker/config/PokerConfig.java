package org.dcbpoker.config;

import org.dcbpoker.model.poker.SecureShuffleSource;
import org.dcbpoker.model.poker.ShuffleSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PokerConfig {

    // remplaçable par un générateur vérifiable sans toucher au moteur
    @Bean
    public ShuffleSource shuffleSource() {
        return new SecureShuffleSource();
    }
}
