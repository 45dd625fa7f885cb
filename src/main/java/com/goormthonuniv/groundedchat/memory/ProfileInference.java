package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.dto.Profile;
import com.goormthonuniv.groundedchat.planner.HeuristicLexicon;

/**
 * 사용자 문장에서 결정론적으로 선호를 뽑는다.
 * 문자 체계 요청, 링크 포함/제외 요청, 해석된 날씨 지역.
 */
public class ProfileInference {

    private final HeuristicLexicon lexicon;

    public ProfileInference(HeuristicLexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * @param explicitLocation 본문에서 직접 찾은 날씨 지역 (프로필 기본값은 넣지 않음)
     */
    public Profile infer(String userText, String explicitLocation) {
        String language = null;
        if (HeuristicLexicon.containsAny(userText, lexicon.traditionalRequests())) language = "zh-Hant";
        else if (HeuristicLexicon.containsAny(userText, lexicon.simplifiedRequests())) language = "zh-Hans";
        else if (HeuristicLexicon.containsAny(userText, lexicon.englishRequests())) language = "en";

        // "不要連結" 은 "要連結" 을 포함하므로 제외 요청을 먼저 본다
        Boolean links = null;
        if (HeuristicLexicon.containsAny(userText, lexicon.linkOptOut())) links = Boolean.FALSE;
        else if (HeuristicLexicon.containsAny(userText, lexicon.linkOptIn())) links = Boolean.TRUE;

        String location = explicitLocation == null || explicitLocation.isBlank() ? null : explicitLocation.strip();
        return new Profile(language, location, links, null);
    }
}
