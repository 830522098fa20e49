package com.example.dispatcher.service;

public interface ChannelResolver {

  /** 会社の既定チャネル。無ければ IllegalStateException。 */
  ChannelSession defaultSession(long companyId);

  /** ID 指定のチャネル。存在しなければ JobNotFoundException。 */
  ChannelSession session(long channelId);
}
