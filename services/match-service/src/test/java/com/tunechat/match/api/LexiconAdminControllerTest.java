package com.tunechat.match.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tunechat.match.lexicon.LexiconStats;
import com.tunechat.match.lexicon.PhraseLexicon;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LexiconAdminController.class)
class LexiconAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PhraseLexicon lexicon;

    @Test
    void addPhraseReturnsNormalizedPhraseAndMappings() throws Exception {
        when(lexicon.addPhrase(eq("Don't Stop Believin'"), any())).thenReturn("dont stop believin");
        when(lexicon.songIdsFor("dont stop believin")).thenReturn(new LinkedHashSet<>(List.of("s1", "s2")));

        mockMvc.perform(post("/internal/lexicon/phrases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phrase\":\"Don't Stop Believin'\",\"song_ids\":[\"s1\",\"s2\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phrase").value("dont stop believin"))
            .andExpect(jsonPath("$.song_ids.length()").value(2))
            .andExpect(jsonPath("$.song_ids[0]").value("s1"));

        verify(lexicon).addPhrase("Don't Stop Believin'", List.of("s1", "s2"));
    }

    @Test
    void addPhraseRequiresPhraseAndSongIds() throws Exception {
        mockMvc.perform(post("/internal/lexicon/phrases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phrase\":\"  \",\"song_ids\":[\"s1\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("phrase is required"));

        mockMvc.perform(post("/internal/lexicon/phrases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phrase\":\"hey jude\",\"song_ids\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("song_ids is required"));

        verifyNoInteractions(lexicon);
    }

    @Test
    void phraseThatNormalizesToNothingIsRejected() throws Exception {
        when(lexicon.addPhrase(anyString(), any())).thenThrow(new IllegalArgumentException("phrase is empty after normalization"));

        mockMvc.perform(post("/internal/lexicon/phrases")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"phrase\":\"!!!\",\"song_ids\":[\"s1\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void statsExposeLexiconSize() throws Exception {
        when(lexicon.stats()).thenReturn(new LexiconStats(4, 6, 1.5, 7));

        mockMvc.perform(get("/internal/lexicon/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_phrases").value(4))
            .andExpect(jsonPath("$.total_song_mappings").value(6))
            .andExpect(jsonPath("$.average_songs_per_phrase").value(1.5))
            .andExpect(jsonPath("$.indexed_words").value(7));
    }

    @Test
    void wordLookupListsPhrases() throws Exception {
        when(lexicon.phrasesForWord("jude")).thenReturn(List.of("hey jude"));

        mockMvc.perform(get("/internal/lexicon/words/jude"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.word").value("jude"))
            .andExpect(jsonPath("$.phrases[0]").value("hey jude"));
    }
}
