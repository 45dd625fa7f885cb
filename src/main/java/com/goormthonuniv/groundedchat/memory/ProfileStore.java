package com.goormthonuniv.groundedchat.memory;

import com.goormthonuniv.groundedchat.dto.Profile;

public interface ProfileStore {
    Profile get(long chatId);

    /** 추가 병합 후 결과 반환 */
    Profile merge(long chatId, Profile updates);

    /** @return 지울 프로필이 있었으면 true */
    boolean clear(long chatId);
}
