package com.tunechat.match.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchRequest {
    private String text;

    @JsonProperty("allow_explicit")
    private Boolean allowExplicit;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("recent_song_ids")
    private List<String> recentSongIds;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Boolean getAllowExplicit() {
        return allowExplicit;
    }

    public void setAllowExplicit(Boolean allowExplicit) {
        this.allowExplicit = allowExplicit;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<String> getRecentSongIds() {
        return recentSongIds;
    }

    public void setRecentSongIds(List<String> recentSongIds) {
        this.recentSongIds = recentSongIds;
    }
}
