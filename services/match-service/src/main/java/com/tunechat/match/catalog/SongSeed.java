package com.tunechat.match.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SongSeed {
    private String id;
    private String title;
    private String artist;
    private Integer year;
    private int popularity;
    private Set<String> tags;
    private Set<String> phrases;
    private List<Double> embedding;

    @JsonProperty("aboutness_embedding")
    private List<Double> aboutnessEmbedding;

    @JsonProperty("is_placeholder")
    private boolean placeholder;

    private String mbid;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getArtist() {
        return artist;
    }

    public void setArtist(String artist) {
        this.artist = artist;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public int getPopularity() {
        return popularity;
    }

    public void setPopularity(int popularity) {
        this.popularity = popularity;
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Set<String> tags) {
        this.tags = tags;
    }

    public Set<String> getPhrases() {
        return phrases;
    }

    public void setPhrases(Set<String> phrases) {
        this.phrases = phrases;
    }

    public List<Double> getEmbedding() {
        return embedding;
    }

    public void setEmbedding(List<Double> embedding) {
        this.embedding = embedding;
    }

    public List<Double> getAboutnessEmbedding() {
        return aboutnessEmbedding;
    }

    public void setAboutnessEmbedding(List<Double> aboutnessEmbedding) {
        this.aboutnessEmbedding = aboutnessEmbedding;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public void setPlaceholder(boolean placeholder) {
        this.placeholder = placeholder;
    }

    public String getMbid() {
        return mbid;
    }

    public void setMbid(String mbid) {
        this.mbid = mbid;
    }
}
