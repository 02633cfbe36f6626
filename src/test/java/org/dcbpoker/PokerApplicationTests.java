package org.dcbpoker;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class PokerApplicationTests {

    @Test
    void contextLoads() {
    }
}
